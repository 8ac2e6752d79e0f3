package com.sentinelplatform.scheduler.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;
import com.sentinelplatform.common.model.Sentinel;
import com.sentinelplatform.common.model.TriggerCondition;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Row of the {@code sentinels} table as PostgREST returns it.
 *
 * Column mapping:
 *   userId             → user_id
 *   walletAddress      → wallet_address
 *   paymentMethod      → payment_method
 *   notificationTarget → discord_webhook
 *   active             → is_active
 *
 * The table also holds encrypted key material; it is never selected.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SentinelRow {

    static final String COLUMNS =
        "id,user_id,wallet_address,threshold,condition,payment_method,discord_webhook,network,is_active,created_at";

    private String id;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("wallet_address")
    private String walletAddress;

    private BigDecimal threshold;

    private String condition;

    @JsonProperty("payment_method")
    private String paymentMethod;

    @JsonProperty("discord_webhook")
    private String notificationTarget;

    private String network;

    @JsonProperty("is_active")
    private Boolean active;

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    public Sentinel toSentinel() {
        return new Sentinel(
            id,
            userId,
            walletAddress,
            threshold,
            TriggerCondition.fromWire(condition),
            PaymentToken.fromWire(paymentMethod),
            NetworkType.fromWire(network),
            Boolean.TRUE.equals(active),
            notificationTarget,
            createdAt != null ? createdAt.toInstant() : null);
    }
}
