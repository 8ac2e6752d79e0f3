package com.sentinelplatform.common.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;
import com.sentinelplatform.common.model.Sentinel;
import com.sentinelplatform.common.model.TriggerCondition;

import java.math.BigDecimal;

/**
 * Body of {@code POST /api/v1/check-price}. Identical on the first request and on the paid
 * retry; the proof travels in headers.
 */
public record CheckRequest(
    @JsonProperty("sentinelId")         String sentinelId,
    @JsonProperty("userId")             String userId,
    @JsonProperty("walletAddress")      String walletAddress,
    @JsonProperty("threshold")          BigDecimal threshold,
    @JsonProperty("condition")          TriggerCondition condition,
    @JsonProperty("network")            NetworkType network,
    @JsonProperty("paymentMethod")      PaymentToken paymentMethod,
    @JsonProperty("notificationTarget") String notificationTarget,
    @JsonProperty("active")             boolean active
) {
    public static CheckRequest from(Sentinel sentinel) {
        return new CheckRequest(
            sentinel.id(),
            sentinel.userId(),
            sentinel.walletAddress(),
            sentinel.threshold(),
            sentinel.condition(),
            sentinel.network(),
            sentinel.paymentMethod(),
            sentinel.notificationTarget(),
            sentinel.active());
    }

    /** Returns a human-readable reason when the request is malformed, otherwise {@code null}. */
    public String validationError() {
        if (sentinelId == null || sentinelId.isBlank()) return "sentinelId is required";
        if (walletAddress == null || walletAddress.isBlank()) return "walletAddress is required";
        if (threshold == null || threshold.signum() <= 0) return "threshold must be greater than zero";
        if (condition == null) return "condition must be 'above' or 'below'";
        return null;
    }
}
