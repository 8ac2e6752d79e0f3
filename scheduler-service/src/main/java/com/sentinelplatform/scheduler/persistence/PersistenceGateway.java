package com.sentinelplatform.scheduler.persistence;

import com.sentinelplatform.common.model.Sentinel;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable store for sentinels and their activity ledger. Failures surface as
 * {@link com.sentinelplatform.common.exception.PersistenceFailedException}.
 */
public interface PersistenceGateway {

    /** Appends one activity record and returns its id. */
    Mono<String> createActivity(ActivityRow row);

    Flux<Sentinel> listAgents(AgentFilter filter);

    Mono<Void> updateAgent(String id, AgentPatch patch);

    /** Most recent first. */
    Flux<ActivityRow> listActivities(String sentinelId, int limit);
}
