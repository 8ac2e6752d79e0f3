package com.sentinelplatform.common.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinelplatform.common.model.PaymentToken;

import java.math.BigDecimal;
import java.time.Instant;

public record SettledCheckResponse(
    @JsonProperty("price")                BigDecimal price,
    @JsonProperty("triggered")            boolean triggered,
    @JsonProperty("cost")                 BigDecimal cost,
    @JsonProperty("tokenUsed")            PaymentToken tokenUsed,
    @JsonProperty("transactionReference") String transactionReference,
    @JsonProperty("timestamp")            Instant timestamp
) {}
