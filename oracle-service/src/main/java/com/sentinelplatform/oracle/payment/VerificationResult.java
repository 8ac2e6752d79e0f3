package com.sentinelplatform.oracle.payment;

public record VerificationResult(boolean verified, String reason) {

    public static VerificationResult ok() {
        return new VerificationResult(true, null);
    }

    public static VerificationResult rejected(String reason) {
        return new VerificationResult(false, reason);
    }
}
