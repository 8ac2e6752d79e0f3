package com.sentinelplatform.common.exception;

import com.sentinelplatform.common.model.ErrorKind;
import com.sentinelplatform.common.protocol.PaymentChallenge;

/**
 * The oracle rejected a paid retry and answered with a fresh challenge.
 * Not retried automatically; the fee stays spent.
 */
public class VerificationFailedException extends SentinelException {

    private final PaymentChallenge challenge;
    private final String signature;

    public VerificationFailedException(PaymentChallenge challenge, String signature) {
        super("Payment verification failed: "
              + (challenge != null && challenge.error() != null ? challenge.error() : "rejected by oracle"));
        this.challenge = challenge;
        this.signature = signature;
    }

    public PaymentChallenge getChallenge() { return challenge; }
    public String getSignature()           { return signature; }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VERIFICATION_FAILED;
    }
}
