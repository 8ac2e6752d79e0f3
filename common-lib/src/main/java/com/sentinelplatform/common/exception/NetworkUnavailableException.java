package com.sentinelplatform.common.exception;

import com.sentinelplatform.common.model.ErrorKind;

/**
 * Transport or RPC failure. Transient: the scheduler retries on the next tick.
 *
 * <p>{@code paymentAttempted} tells the scheduler whether a fee may already have left
 * the wallet, which decides whether the cycle is recorded.
 */
public class NetworkUnavailableException extends SentinelException {

    private final boolean paymentAttempted;

    public NetworkUnavailableException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public NetworkUnavailableException(String message, Throwable cause, boolean paymentAttempted) {
        super(message, cause);
        this.paymentAttempted = paymentAttempted;
    }

    public boolean isPaymentAttempted() {
        return paymentAttempted;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NETWORK_UNAVAILABLE;
    }
}
