package com.sentinelplatform.scheduler.balance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;

import java.math.BigDecimal;

public record WalletBalances(
    @JsonProperty("walletAddress")   String walletAddress,
    @JsonProperty("network")         NetworkType network,
    @JsonProperty("nativeBalance")   BigDecimal nativeBalance,
    @JsonProperty("token")           PaymentToken token,
    @JsonProperty("tokenBalance")    BigDecimal tokenBalance,
    @JsonProperty("funded")          boolean funded,
    @JsonProperty("remainingChecks") long remainingChecks
) {}
