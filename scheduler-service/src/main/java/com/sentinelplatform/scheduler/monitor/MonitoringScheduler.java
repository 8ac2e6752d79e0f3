package com.sentinelplatform.scheduler.monitor;

import com.sentinelplatform.common.model.ActivityOutcome;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.Sentinel;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import com.sentinelplatform.common.notification.AlertEventPublisher;
import com.sentinelplatform.common.notification.AutoPauseEvent;
import com.sentinelplatform.common.trace.TraceContextUtil;
import com.sentinelplatform.scheduler.client.CheckResult;
import com.sentinelplatform.scheduler.client.PriceCheckClient;
import com.sentinelplatform.scheduler.ledger.ActivityRecorder;
import com.sentinelplatform.scheduler.persistence.AgentFilter;
import com.sentinelplatform.scheduler.persistence.AgentPatch;
import com.sentinelplatform.scheduler.persistence.PersistenceGateway;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs one independent check loop per active agent.
 *
 * <p>Each loop is a single pipeline:
 * <pre>
 *   interval(0, period) → drop tick if a cycle is in flight → check → record → (auto-pause?)
 * </pre>
 * The first cycle runs immediately. A tick arriving while the previous cycle is still running
 * is dropped, so one agent never has two cycles at once. Loops share no mutable state.
 *
 * <p>Failures never end a loop, except running out of funds: that cycle is recorded, the agent
 * is marked {@link AgentLoopState#PAUSED_INSUFFICIENT_FUNDS}, its durable {@code active} flag is
 * cleared and an auto-pause notice goes out.
 *
 * <p>This class is the only writer of an agent's durable {@code active} flag.
 */
@Component
public class MonitoringScheduler {

    private static final Logger log = LoggerFactory.getLogger(MonitoringScheduler.class);

    static final String AUTO_PAUSE_REASON = "Insufficient funds to pay for price checks";

    private final ConcurrentHashMap<String, MonitorHandle> loops = new ConcurrentHashMap<>();

    private final PriceCheckClient checkClient;
    private final ActivityRecorder recorder;
    private final PersistenceGateway gateway;
    private final AlertEventPublisher publisher;
    private final NetworkProfileResolver resolver;
    private final Scheduler scheduler;
    private final Duration period;
    private final Duration writeGrace;
    private final ExclusivityMode mode;
    private final boolean autostart;

    public MonitoringScheduler(PriceCheckClient checkClient,
                               ActivityRecorder recorder,
                               PersistenceGateway gateway,
                               AlertEventPublisher publisher,
                               NetworkProfileResolver resolver,
                               @Qualifier("monitorScheduler") Scheduler scheduler,
                               @Value("${sentinel.scheduler.period:30s}") Duration period,
                               @Value("${sentinel.scheduler.stop-write-grace:5s}") Duration writeGrace,
                               @Value("${sentinel.scheduler.mode:multi}") String mode,
                               @Value("${sentinel.scheduler.autostart:true}") boolean autostart) {
        if (writeGrace.compareTo(recorder.writeTimeout()) <= 0) {
            throw new IllegalArgumentException("sentinel.scheduler.stop-write-grace (" + writeGrace
                + ") must exceed sentinel.persistence.write-timeout (" + recorder.writeTimeout() + ")");
        }
        this.checkClient = checkClient;
        this.recorder    = recorder;
        this.gateway     = gateway;
        this.publisher   = publisher;
        this.resolver    = resolver;
        this.scheduler   = scheduler;
        this.period      = period;
        this.writeGrace  = writeGrace;
        this.mode        = ExclusivityMode.fromConfig(mode);
        this.autostart   = autostart;
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    @EventListener(ApplicationReadyEvent.class)
    public void startActiveAgents() {
        if (!autostart) {
            log.info("Autostart disabled. mode={} period={}", mode, period);
            return;
        }
        NetworkType network = resolver.resolveNetwork().type();
        log.info("Autostart. network={} mode={} periodSeconds={}", network.wireValue(), mode, period.toSeconds());

        Set<String> claimed = new HashSet<>();
        gateway.listAgents(AgentFilter.activeOn(network))
            .filter(s -> {
                if (mode == ExclusivityMode.SINGLE && !claimed.add(s.userId())) {
                    log.warn("Autostart skipped, user already has a running agent. sentinelId={} userId={}",
                             s.id(), s.userId());
                    return false;
                }
                return true;
            })
            .map(this::launch)
            .count()
            .subscribe(
                n   -> log.info("Autostart complete. started={}", n),
                err -> log.error("Autostart failed to load active agents", err)
            );
    }

    @PreDestroy
    public void stopAll() {
        List<String> ids = new ArrayList<>(loops.keySet());
        ids.forEach(this::stop);
        log.info("All monitoring loops stopped. count={}", ids.size());
    }

    // ── public operations ─────────────────────────────────────────────────────

    /**
     * Starts the loop for {@code sentinel}. Idempotent: a running loop is left alone.
     * In single mode the user's other agents on the same network are stopped and deactivated first.
     */
    public Mono<AgentStatus> start(Sentinel sentinel) {
        Mono<Void> exclusivity = mode == ExclusivityMode.SINGLE ? stopSiblings(sentinel) : Mono.empty();
        return exclusivity.then(Mono.fromSupplier(() -> launch(sentinel)));
    }

    /** Sets the durable flag and starts the loop. */
    public Mono<AgentStatus> activate(String sentinelId) {
        return gateway.listAgents(AgentFilter.byId(sentinelId))
            .next()
            .switchIfEmpty(Mono.error(new IllegalArgumentException("Unknown sentinel: " + sentinelId)))
            .flatMap(sentinel -> gateway.updateAgent(sentinelId, AgentPatch.activate())
                .then(start(sentinel.withActive(true))));
    }

    /** Stops the loop and clears the durable flag. */
    public Mono<Boolean> deactivate(String sentinelId) {
        return Mono.fromCallable(() -> stop(sentinelId))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(wasRunning -> gateway.updateAgent(sentinelId, AgentPatch.deactivate()).thenReturn(wasRunning));
    }

    /**
     * Cancels the loop, including any in-flight check or confirmation wait. Returns once no further
     * record can be written for the stopped run. Blocking: call off the event loop.
     *
     * @return whether a loop was running
     */
    public boolean stop(String sentinelId) {
        MonitorHandle handle = loops.remove(sentinelId);
        if (handle == null) {
            return false;
        }
        boolean wasRunning = handle.isRunning();
        handle.stop(writeGrace);
        log.info("Monitoring stopped. sentinelId={} runId={} cycles={}",
                 sentinelId, handle.runId(), handle.cyclesExecuted());
        return wasRunning;
    }

    public AgentStatus status(String sentinelId) {
        MonitorHandle handle = loops.get(sentinelId);
        return handle != null ? handle.status() : AgentStatus.stopped(sentinelId);
    }

    public List<AgentStatus> statuses() {
        return loops.values().stream().map(MonitorHandle::status).toList();
    }

    public long runningCount() {
        return loops.values().stream().filter(MonitorHandle::isRunning).count();
    }

    public ExclusivityMode mode() {
        return mode;
    }

    // ── loop ──────────────────────────────────────────────────────────────────

    AgentStatus launch(Sentinel sentinel) {
        MonitorHandle handle = loops.compute(sentinel.id(), (id, existing) ->
            existing != null && existing.isRunning()
                ? existing
                : new MonitorHandle(sentinel, Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS))));

        if (!handle.claimStart()) {
            log.info("Monitoring already running. sentinelId={} runId={}", sentinel.id(), handle.runId());
            return handle.status();
        }

        log.info("Monitoring started. sentinelId={} runId={} network={} periodSeconds={}",
                 sentinel.id(), handle.runId(), sentinel.network().wireValue(), period.toSeconds());

        handle.attach(Flux.interval(Duration.ZERO, period, scheduler)
            .onBackpressureDrop(tick -> log.debug("Tick dropped, cycle in flight. sentinelId={} tick={}",
                                                  sentinel.id(), tick))
            .flatMap(tick -> runCycle(handle), 1, 1)
            .subscribe(
                v   -> {},
                err -> log.error("Monitoring loop terminated unexpectedly. sentinelId={}", sentinel.id(), err)
            ));
        return handle.status();
    }

    private Mono<Void> runCycle(MonitorHandle handle) {
        Sentinel sentinel = handle.sentinel();
        Mono<Void> cycle = checkClient.check(sentinel)
            .flatMap(result -> complete(handle, result))
            .onErrorResume(e -> Mono.deferContextual(ctx -> {
                TraceContextUtil.withMdc(ctx, () ->
                    log.error("Cycle failed unexpectedly. sentinelId={} runId={}", sentinel.id(), handle.runId(), e));
                return Mono.empty();
            }));
        return TraceContextUtil.withCycle(cycle, sentinel.id(), handle.runId());
    }

    private Mono<Void> complete(MonitorHandle handle, CheckResult result) {
        Sentinel sentinel = handle.sentinel();
        ActivityOutcome outcome = result.toOutcome(Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS)));
        handle.cycleCompleted(outcome);

        Mono<Void> write;
        if (result.shouldRecord()) {
            write = recorder.record(sentinel, outcome, handle).then();
        } else {
            log.warn("Cycle not recorded, oracle unreachable before payment. sentinelId={} runId={} reason={}",
                     sentinel.id(), handle.runId(), outcome.errorMessage());
            write = Mono.empty();
        }

        return write.then(Mono.defer(() -> {
            if (result.isFundsExhausted()) {
                return autoPause(handle, outcome);
            }
            if (result.isSettled()) {
                log.info("Cycle complete. sentinelId={} runId={} price={} triggered={} cost={}",
                         sentinel.id(), handle.runId(), outcome.price(), outcome.triggered(), outcome.cost());
            } else {
                log.warn("Cycle failed, will retry next tick. sentinelId={} runId={} kind={} reason={}",
                         sentinel.id(), handle.runId(), outcome.errorKind(), outcome.errorMessage());
            }
            return Mono.empty();
        }));
    }

    private Mono<Void> autoPause(MonitorHandle handle, ActivityOutcome outcome) {
        Sentinel sentinel = handle.sentinel();
        handle.pause();
        log.warn("AUTO_PAUSE sentinelId={} runId={} reason={}", sentinel.id(), handle.runId(), outcome.errorMessage());

        return gateway.updateAgent(sentinel.id(), AgentPatch.deactivate())
            .onErrorResume(e -> {
                log.error("Failed to clear active flag on auto-pause. sentinelId={}", sentinel.id(), e);
                return Mono.empty();
            })
            .then(Mono.fromRunnable(() -> {
                if (sentinel.notificationTarget() != null && !sentinel.notificationTarget().isBlank()) {
                    publisher.publishAutoPause(new AutoPauseEvent(sentinel.id(), sentinel.notificationTarget(),
                        sentinel.walletAddress(), AUTO_PAUSE_REASON, Instant.now()));
                }
            }))
            .then(Mono.fromRunnable(handle::dispose));
    }

    // ── exclusivity ───────────────────────────────────────────────────────────

    private Mono<Void> stopSiblings(Sentinel sentinel) {
        Flux<String> running = Flux.fromIterable(loops.values())
            .map(MonitorHandle::sentinel)
            .filter(other -> isSibling(sentinel, other))
            .map(Sentinel::id);
        Flux<String> durable = gateway.listAgents(AgentFilter.activeFor(sentinel.userId(), sentinel.network()))
            .filter(other -> !other.id().equals(sentinel.id()))
            .map(Sentinel::id)
            .onErrorResume(e -> {
                log.error("Could not list sibling agents. sentinelId={}", sentinel.id(), e);
                return Flux.empty();
            });

        return Flux.concat(running, durable)
            .distinct()
            .concatMap(id -> deactivate(id)
                .doOnNext(wasRunning -> log.info("Sibling deactivated (single mode). sentinelId={} startedFor={}",
                                                 id, sentinel.id()))
                .onErrorResume(e -> {
                    log.error("Failed to deactivate sibling. sentinelId={}", id, e);
                    return Mono.empty();
                }))
            .then();
    }

    private static boolean isSibling(Sentinel started, Sentinel other) {
        return !other.id().equals(started.id())
            && other.userId() != null && other.userId().equals(started.userId())
            && other.network() == started.network();
    }

    Optional<MonitorHandle> handle(String sentinelId) {
        return Optional.ofNullable(loops.get(sentinelId));
    }
}
