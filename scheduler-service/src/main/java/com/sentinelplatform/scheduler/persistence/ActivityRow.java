package com.sentinelplatform.scheduler.persistence;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinelplatform.common.model.ActivityOutcome;
import com.sentinelplatform.common.model.Sentinel;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Row of the append-only {@code activities} table. {@code id} and {@code created_at} are
 * assigned by the database on insert.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActivityRow {

    private String id;

    @JsonProperty("sentinel_id")
    private String sentinelId;

    @JsonProperty("user_id")
    private String userId;

    private BigDecimal price;

    private BigDecimal cost;

    @JsonProperty("settlement_time")
    private Long settlementTimeMs;

    @JsonProperty("payment_method")
    private String paymentMethod;

    @JsonProperty("transaction_signature")
    private String transactionSignature;

    private Boolean triggered;

    /** {@code success} or {@code failed} */
    private String status;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    public static ActivityRow of(Sentinel sentinel, ActivityOutcome outcome) {
        ActivityRow row = new ActivityRow();
        row.setSentinelId(sentinel.id());
        row.setUserId(sentinel.userId());
        row.setPrice(outcome.price());
        row.setCost(outcome.cost());
        row.setSettlementTimeMs(outcome.settlementTimeMs());
        row.setPaymentMethod(outcome.paymentMethod() != null ? outcome.paymentMethod().wireValue() : null);
        row.setTransactionSignature(outcome.transactionSignature());
        row.setTriggered(outcome.triggered());
        row.setStatus(outcome.status().wireValue());
        row.setErrorMessage(outcome.errorMessage());
        row.setCreatedAt(outcome.checkedAt() != null ? outcome.checkedAt().atOffset(ZoneOffset.UTC) : null);
        return row;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return "success".equals(status);
    }
}
