package com.sentinelplatform.scheduler.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinelplatform.common.model.ActivityOutcome;

import java.time.Instant;

public record AgentStatus(
    @JsonProperty("sentinelId")     String sentinelId,
    @JsonProperty("state")          AgentLoopState state,
    @JsonProperty("runId")          String runId,
    @JsonProperty("startedAt")      Instant startedAt,
    @JsonProperty("cyclesExecuted") long cyclesExecuted,
    @JsonProperty("lastOutcome")    ActivityOutcome lastOutcome
) {
    public static AgentStatus stopped(String sentinelId) {
        return new AgentStatus(sentinelId, AgentLoopState.STOPPED, null, null, 0, null);
    }
}
