package com.sentinelplatform.common.notification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Payload of {@code POST /api/v1/notify/auto-pause}. Rendered differently from a price alert. */
public record AutoPauseEvent(
    @JsonProperty("sentinelId")    String sentinelId,
    @JsonProperty("target")        String target,
    @JsonProperty("walletAddress") String walletAddress,
    @JsonProperty("reason")        String reason,
    @JsonProperty("timestamp")     Instant timestamp
) {}
