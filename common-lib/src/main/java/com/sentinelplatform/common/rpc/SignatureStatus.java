package com.sentinelplatform.common.rpc;

/**
 * One entry of {@code getSignatureStatuses}. {@code found=false} means the cluster has not
 * seen the signature yet.
 */
public record SignatureStatus(boolean found, String confirmationStatus, String error) {

    public static SignatureStatus notFound() {
        return new SignatureStatus(false, null, null);
    }

    public boolean failed() {
        return error != null;
    }

    public boolean isConfirmed() {
        return found && !failed()
            && ("confirmed".equals(confirmationStatus) || "finalized".equals(confirmationStatus));
    }
}
