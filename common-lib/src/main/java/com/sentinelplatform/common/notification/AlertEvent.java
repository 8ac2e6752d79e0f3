package com.sentinelplatform.common.notification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/** Payload of {@code POST /api/v1/notify/alert}. */
public record AlertEvent(
    @JsonProperty("sentinelId") String sentinelId,
    @JsonProperty("target")     String target,
    @JsonProperty("title")      String title,
    @JsonProperty("price")      BigDecimal price,
    @JsonProperty("threshold")  BigDecimal threshold,
    @JsonProperty("timestamp")  Instant timestamp
) {}
