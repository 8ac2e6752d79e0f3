package com.sentinelplatform.common.protocol;

/**
 * Client-side lifecycle of one price check.
 *
 * <pre>
 * INIT → REQUEST_SENT → CHALLENGED → PAYING → PAID_RETRY_SENT → SETTLED
 *                  └────────────┴─────────┴──────────────┴──→ FAILED
 * </pre>
 * A first request answered with 200 goes straight to SETTLED.
 */
public enum CheckState {
    INIT,
    REQUEST_SENT,
    CHALLENGED,
    PAYING,
    PAID_RETRY_SENT,
    SETTLED,
    FAILED;

    public boolean isTerminal() {
        return this == SETTLED || this == FAILED;
    }

    /** True once funds may have left the wallet. */
    public boolean isPaymentAttempted() {
        return this == PAYING || this == PAID_RETRY_SENT;
    }
}
