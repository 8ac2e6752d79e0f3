package com.sentinelplatform.common.exception;

import com.sentinelplatform.common.model.ErrorKind;

/** A transfer was submitted but never confirmed. The signature is kept for the ledger. */
public class PaymentFailedException extends SentinelException {

    private final String signature;

    public PaymentFailedException(String message, String signature) {
        super(message);
        this.signature = signature;
    }

    public PaymentFailedException(String message, String signature, Throwable cause) {
        super(message, cause);
        this.signature = signature;
    }

    public String getSignature() {
        return signature;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PAYMENT_FAILED;
    }
}
