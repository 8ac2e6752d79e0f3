package com.sentinelplatform.scheduler.persistence;

import com.sentinelplatform.common.model.NetworkType;

/** Conjunctive filter over sentinels; {@code null} fields are not constrained. */
public record AgentFilter(String id, String userId, NetworkType network, Boolean active) {

    public static AgentFilter byId(String id) {
        return new AgentFilter(id, null, null, null);
    }

    public static AgentFilter activeOn(NetworkType network) {
        return new AgentFilter(null, null, network, true);
    }

    public static AgentFilter activeFor(String userId, NetworkType network) {
        return new AgentFilter(null, userId, network, true);
    }
}
