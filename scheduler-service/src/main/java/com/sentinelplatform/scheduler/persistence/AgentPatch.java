package com.sentinelplatform.scheduler.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Partial update of a sentinel. Only the scheduler writes {@code is_active}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentPatch(@JsonProperty("is_active") Boolean active) {

    public static AgentPatch deactivate() {
        return new AgentPatch(false);
    }

    public static AgentPatch activate() {
        return new AgentPatch(true);
    }
}
