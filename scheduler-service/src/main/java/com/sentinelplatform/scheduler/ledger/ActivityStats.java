package com.sentinelplatform.scheduler.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

public record ActivityStats(
    @JsonProperty("sentinelId")      String sentinelId,
    @JsonProperty("totalChecks")     int totalChecks,
    @JsonProperty("totalSpent")      BigDecimal totalSpent,
    @JsonProperty("alertsTriggered") int alertsTriggered,
    @JsonProperty("successRate")     double successRate,
    @JsonProperty("averageCost")     BigDecimal averageCost,
    @JsonProperty("lastCheck")       Instant lastCheck
) {}
