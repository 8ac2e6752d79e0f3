package com.sentinelplatform.common.exception;

import com.sentinelplatform.common.model.ErrorKind;

/** Payment was verified but every price source failed. Surfaces as HTTP 503. */
public class PriceUnavailableException extends SentinelException {

    private final String signature;

    public PriceUnavailableException(String message, String signature) {
        super(message);
        this.signature = signature;
    }

    public String getSignature() {
        return signature;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PRICE_UNAVAILABLE;
    }
}
