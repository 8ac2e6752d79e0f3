package com.sentinelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Result of one completed check cycle, as handed to the activity ledger.
 *
 * <p>{@code transactionSignature}, {@code errorKind} and {@code errorMessage} are nullable.
 * {@code cost} is the fee actually transferred; zero when no transfer took place.
 */
public record ActivityOutcome(
    @JsonProperty("price")                BigDecimal price,
    @JsonProperty("cost")                 BigDecimal cost,
    @JsonProperty("settlementTimeMs")     Long settlementTimeMs,
    @JsonProperty("paymentMethod")        PaymentToken paymentMethod,
    @JsonProperty("transactionSignature") String transactionSignature,
    @JsonProperty("triggered")            boolean triggered,
    @JsonProperty("status")               ActivityStatus status,
    @JsonProperty("errorKind")            ErrorKind errorKind,
    @JsonProperty("errorMessage")         String errorMessage,
    @JsonProperty("checkedAt")            Instant checkedAt
) {
    public static ActivityOutcome success(BigDecimal price, BigDecimal cost, Long settlementTimeMs,
                                          PaymentToken token, String signature, boolean triggered,
                                          Instant checkedAt) {
        return new ActivityOutcome(price, cost, settlementTimeMs, token, signature, triggered,
                                   ActivityStatus.SUCCESS, null, null, checkedAt);
    }

    public static ActivityOutcome failure(BigDecimal cost, PaymentToken token, String signature,
                                          ErrorKind kind, String message, Instant checkedAt) {
        return new ActivityOutcome(BigDecimal.ZERO, cost, null, token, signature, false,
                                   ActivityStatus.FAILED, kind, message, checkedAt);
    }

    public boolean isFundsExhausted() {
        return status == ActivityStatus.FAILED && errorKind == ErrorKind.INSUFFICIENT_FUNDS;
    }
}
