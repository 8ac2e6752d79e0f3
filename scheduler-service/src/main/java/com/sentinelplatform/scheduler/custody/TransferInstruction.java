package com.sentinelplatform.scheduler.custody;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinelplatform.common.model.NetworkType;

import java.math.BigInteger;

/**
 * Unsigned SPL token transfer handed to the custody service. The custody side derives the
 * associated token accounts, creating the recipient's if needed, and signs with the wallet key.
 */
public record TransferInstruction(
    @JsonProperty("fromWallet")      String fromWallet,
    @JsonProperty("toAddress")       String toAddress,
    @JsonProperty("mint")            String mint,
    @JsonProperty("amount")          BigInteger amountBaseUnits,
    @JsonProperty("decimals")        int decimals,
    @JsonProperty("recentBlockhash") String recentBlockhash,
    @JsonProperty("network")         NetworkType network
) {}
