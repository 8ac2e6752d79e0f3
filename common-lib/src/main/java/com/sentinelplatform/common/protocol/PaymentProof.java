package com.sentinelplatform.common.protocol;

import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;

import java.math.BigDecimal;

/**
 * What the oracle checks a submitted signature against: the transfer must have left
 * {@code payerWallet} and landed at {@code recipient} in {@code token} for at least {@code amount}.
 */
public record PaymentProof(
    String signature,
    PaymentToken token,
    NetworkType network,
    String recipient,
    BigDecimal amount,
    String payerWallet
) {}
