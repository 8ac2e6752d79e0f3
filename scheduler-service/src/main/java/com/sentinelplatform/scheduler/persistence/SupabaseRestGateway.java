package com.sentinelplatform.scheduler.persistence;

import com.sentinelplatform.common.exception.PersistenceFailedException;
import com.sentinelplatform.common.model.Sentinel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * {@link PersistenceGateway} over Supabase's PostgREST API ({@code /rest/v1}).
 *
 * <p>The {@code supabaseClient} bean carries the base URL and the service-role headers.
 * Filters follow PostgREST syntax, e.g. {@code is_active=eq.true}.
 */
@Component
public class SupabaseRestGateway implements PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(SupabaseRestGateway.class);

    private static final ParameterizedTypeReference<List<ActivityRow>> ACTIVITY_LIST =
        new ParameterizedTypeReference<>() {};

    private final WebClient supabaseClient;

    public SupabaseRestGateway(@Qualifier("supabaseClient") WebClient supabaseClient) {
        this.supabaseClient = supabaseClient;
    }

    @Override
    public Mono<String> createActivity(ActivityRow row) {
        return supabaseClient.post()
            .uri("/activities")
            .header("Prefer", "return=representation")
            .bodyValue(row)
            .retrieve()
            .bodyToMono(ACTIVITY_LIST)
            .flatMap(rows -> rows.isEmpty()
                ? Mono.error(new IllegalStateException("insert returned no row"))
                : Mono.justOrEmpty(rows.get(0).getId()))
            .onErrorMap(e -> !(e instanceof PersistenceFailedException),
                        e -> new PersistenceFailedException(
                            "createActivity failed for sentinelId=" + row.getSentinelId(), e));
    }

    @Override
    public Flux<Sentinel> listAgents(AgentFilter filter) {
        return supabaseClient.get()
            .uri(uri -> applyFilter(uri.path("/sentinels").queryParam("select", SentinelRow.COLUMNS), filter)
                .queryParam("order", "created_at.asc")
                .build())
            .retrieve()
            .bodyToFlux(SentinelRow.class)
            .map(SentinelRow::toSentinel)
            .onErrorMap(e -> new PersistenceFailedException("listAgents failed: " + filter, e));
    }

    @Override
    public Mono<Void> updateAgent(String id, AgentPatch patch) {
        return supabaseClient.patch()
            .uri(uri -> uri.path("/sentinels").queryParam("id", "eq." + id).build())
            .bodyValue(patch)
            .retrieve()
            .toBodilessEntity()
            .doOnSuccess(r -> log.info("Sentinel updated. sentinelId={} patch={}", id, patch))
            .onErrorMap(e -> new PersistenceFailedException("updateAgent failed for sentinelId=" + id, e))
            .then();
    }

    @Override
    public Flux<ActivityRow> listActivities(String sentinelId, int limit) {
        return supabaseClient.get()
            .uri(uri -> uri.path("/activities")
                .queryParam("sentinel_id", "eq." + sentinelId)
                .queryParam("order", "created_at.desc")
                .queryParam("limit", limit)
                .build())
            .retrieve()
            .bodyToFlux(ActivityRow.class)
            .onErrorMap(e -> new PersistenceFailedException("listActivities failed for sentinelId=" + sentinelId, e));
    }

    private static UriBuilder applyFilter(UriBuilder uri, AgentFilter filter) {
        if (filter.id() != null)      uri.queryParam("id", "eq." + filter.id());
        if (filter.userId() != null)  uri.queryParam("user_id", "eq." + filter.userId());
        if (filter.network() != null) uri.queryParam("network", "eq." + filter.network().wireValue());
        if (filter.active() != null)  uri.queryParam("is_active", "eq." + filter.active());
        return uri;
    }
}
