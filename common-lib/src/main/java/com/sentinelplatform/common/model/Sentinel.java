package com.sentinelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A configured, wallet-holding price monitor.
 *
 * <p>{@code network} and {@code walletAddress} are fixed at creation. Signing material is
 * never part of this record; it stays with the wallet custody service.
 */
public record Sentinel(
    @JsonProperty("id")                 String id,
    @JsonProperty("userId")             String userId,
    @JsonProperty("walletAddress")      String walletAddress,
    @JsonProperty("threshold")          BigDecimal threshold,
    @JsonProperty("condition")          TriggerCondition condition,
    @JsonProperty("paymentMethod")      PaymentToken paymentMethod,
    @JsonProperty("network")            NetworkType network,
    @JsonProperty("active")             boolean active,
    @JsonProperty("notificationTarget") String notificationTarget,
    @JsonProperty("createdAt")          Instant createdAt
) {
    /** Unset preference falls back to USDC, the token every network accepts. */
    public PaymentToken preferredToken() {
        return paymentMethod != null ? paymentMethod : PaymentToken.USDC;
    }

    public Sentinel withActive(boolean value) {
        return new Sentinel(id, userId, walletAddress, threshold, condition, paymentMethod,
                            network, value, notificationTarget, createdAt);
    }
}
