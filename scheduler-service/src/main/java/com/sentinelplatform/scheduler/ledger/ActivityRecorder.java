package com.sentinelplatform.scheduler.ledger;

import com.sentinelplatform.common.model.ActivityOutcome;
import com.sentinelplatform.common.model.Sentinel;
import com.sentinelplatform.scheduler.persistence.ActivityRow;
import com.sentinelplatform.scheduler.persistence.PersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes one immutable activity record per completed check cycle.
 *
 * <p>A persistence failure is logged and swallowed: the cycle still counts as executed and the
 * loop keeps running. A write the gate refuses (the loop was stopped) is skipped silently.
 *
 * <p>Every write is bounded by {@code writeTimeout} and cancelled when it runs over, so a write
 * holds its gate for at most that long.
 */
@Component
public class ActivityRecorder {

    private static final Logger log = LoggerFactory.getLogger(ActivityRecorder.class);

    private final PersistenceGateway gateway;
    private final int statsWindow;
    private final Duration writeTimeout;

    public ActivityRecorder(PersistenceGateway gateway,
                            @Value("${sentinel.stats.window:1000}") int statsWindow,
                            @Value("${sentinel.persistence.write-timeout:3s}") Duration writeTimeout) {
        this.gateway      = gateway;
        this.statsWindow  = statsWindow;
        this.writeTimeout = writeTimeout;
    }

    public Duration writeTimeout() {
        return writeTimeout;
    }

    /** @return the new record's id, or empty when refused or the write failed */
    public Mono<Optional<String>> record(Sentinel sentinel, ActivityOutcome outcome, WriteGate gate) {
        return Mono.defer(() -> {
            if (!gate.tryBeginWrite()) {
                log.info("Activity write refused, loop stopped. sentinelId={}", sentinel.id());
                return Mono.just(Optional.<String>empty());
            }
            return gateway.createActivity(ActivityRow.of(sentinel, outcome))
                .timeout(writeTimeout)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .doOnNext(id -> log.info("Activity recorded. sentinelId={} activityId={} status={} cost={}",
                                         sentinel.id(), id.orElse("?"), outcome.status().wireValue(), outcome.cost()))
                .onErrorResume(e -> {
                    log.error("Activity write failed, cycle still counted. sentinelId={} reason={}",
                              sentinel.id(), e.getMessage());
                    return Mono.just(Optional.empty());
                })
                .doFinally(signal -> gate.endWrite());
        });
    }

    public Mono<ActivityStats> stats(String sentinelId) {
        return gateway.listActivities(sentinelId, statsWindow)
            .collectList()
            .map(rows -> summarize(sentinelId, rows));
    }

    static ActivityStats summarize(String sentinelId, List<ActivityRow> rows) {
        int total = rows.size();
        if (total == 0) {
            return new ActivityStats(sentinelId, 0, BigDecimal.ZERO, 0, 0.0, BigDecimal.ZERO, null);
        }
        BigDecimal spent = rows.stream()
            .map(ActivityRow::getCost)
            .filter(Objects::nonNull)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        int alerts    = (int) rows.stream().filter(r -> Boolean.TRUE.equals(r.getTriggered())).count();
        int successes = (int) rows.stream().filter(ActivityRow::isSuccess).count();
        Instant last  = rows.stream()
            .map(ActivityRow::getCreatedAt)
            .filter(Objects::nonNull)
            .map(OffsetDateTime::toInstant)
            .max(Instant::compareTo)
            .orElse(null);

        return new ActivityStats(
            sentinelId,
            total,
            spent,
            alerts,
            (double) successes / total,
            spent.divide(BigDecimal.valueOf(total), 8, RoundingMode.HALF_UP),
            last);
    }
}
