package com.sentinelplatform.common.model;

/**
 * Failure categories carried on failed outcomes. The scheduler keys its
 * pause decision on {@link #INSUFFICIENT_FUNDS}; everything else is retried next tick.
 */
public enum ErrorKind {
    NETWORK_UNAVAILABLE,
    INSUFFICIENT_FUNDS,
    PAYMENT_CEILING_EXCEEDED,
    UNSUPPORTED_TOKEN,
    PAYMENT_FAILED,
    VERIFICATION_FAILED,
    PRICE_UNAVAILABLE,
    UNEXPECTED
}
