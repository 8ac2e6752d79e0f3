package com.sentinelplatform.scheduler.client;

import com.sentinelplatform.common.exception.InsufficientFundsException;
import com.sentinelplatform.common.exception.NetworkUnavailableException;
import com.sentinelplatform.common.exception.PaymentFailedException;
import com.sentinelplatform.common.exception.SentinelException;
import com.sentinelplatform.common.model.ActivityOutcome;
import com.sentinelplatform.common.model.ErrorKind;
import com.sentinelplatform.common.model.PaymentToken;
import com.sentinelplatform.common.protocol.CheckState;
import com.sentinelplatform.common.protocol.SettledCheckResponse;
import com.sentinelplatform.scheduler.payment.TransactionReference;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Terminal state of one price check. Exactly one of {@code settled} / {@code failure} is set.
 * {@code payment} is set once a transfer was confirmed, whatever happened afterwards.
 */
public record CheckResult(
    CheckState state,
    SettledCheckResponse settled,
    PaymentToken token,
    TransactionReference payment,
    Throwable failure
) {
    public static CheckResult settled(SettledCheckResponse response, PaymentToken token, TransactionReference payment) {
        return new CheckResult(CheckState.SETTLED, response, token, payment, null);
    }

    public static CheckResult failed(Throwable failure, PaymentToken token, TransactionReference payment) {
        return new CheckResult(CheckState.FAILED, null, token, payment, failure);
    }

    public boolean isSettled() {
        return state == CheckState.SETTLED;
    }

    public boolean isFundsExhausted() {
        return failure instanceof InsufficientFundsException;
    }

    /** True when funds may have left the wallet during this check. */
    public boolean paymentAttempted() {
        if (payment != null || signature() != null) return true;
        return failure instanceof NetworkUnavailableException nu && nu.isPaymentAttempted();
    }

    /** Every outcome is recorded except a transport failure before any payment attempt. */
    public boolean shouldRecord() {
        return !(failure instanceof NetworkUnavailableException) || paymentAttempted();
    }

    /** The fee that actually moved: the confirmed amount, otherwise zero. */
    public BigDecimal charged() {
        return payment != null ? payment.amount() : BigDecimal.ZERO;
    }

    public String signature() {
        if (payment != null) return payment.signature();
        if (failure instanceof PaymentFailedException pf) return pf.getSignature();
        return null;
    }

    public ErrorKind errorKind() {
        if (failure == null) return null;
        return failure instanceof SentinelException se ? se.kind() : ErrorKind.UNEXPECTED;
    }

    public ActivityOutcome toOutcome(Instant checkedAt) {
        if (isSettled()) {
            PaymentToken used = settled.tokenUsed() != null ? settled.tokenUsed() : token;
            return ActivityOutcome.success(settled.price(), charged(),
                                           payment != null ? payment.settlementTimeMs() : null,
                                           used, signature(), settled.triggered(), checkedAt);
        }
        return ActivityOutcome.failure(charged(), token, signature(), errorKind(),
                                       failure != null ? failure.getMessage() : null, checkedAt);
    }
}
