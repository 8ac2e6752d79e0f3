package com.sentinelplatform.scheduler.payment;

import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;

import java.math.BigDecimal;

/** A confirmed transfer. {@code settlementTimeMs} runs from pre-flight to confirmation. */
public record TransactionReference(
    String signature,
    PaymentToken token,
    BigDecimal amount,
    NetworkType network,
    long settlementTimeMs,
    String explorerUrl
) {}
