package com.sentinelplatform.scheduler.monitor;

import com.sentinelplatform.common.model.ActivityOutcome;
import com.sentinelplatform.common.model.Sentinel;
import com.sentinelplatform.scheduler.ledger.WriteGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One run of one agent's monitoring loop.
 *
 * <p>The handle is also the loop's {@link WriteGate}. Once {@link #stop} or {@link #pause} has
 * run, every later write is refused, so nothing is recorded for this run after it was stopped.
 * {@code stop} lets a write already in progress finish or time out before cancelling the loop;
 * the grace is always longer than the recorder's write timeout.
 */
public final class MonitorHandle implements WriteGate {

    private static final Logger log = LoggerFactory.getLogger(MonitorHandle.class);

    private final Sentinel sentinel;
    private final String runId = UUID.randomUUID().toString();
    private final Instant startedAt;
    private final AtomicLong cycles = new AtomicLong();

    private volatile AgentLoopState state = AgentLoopState.RUNNING;
    private volatile ActivityOutcome lastOutcome;
    private volatile Disposable subscription;

    // guarded by this
    private boolean attached;
    private boolean stopped;
    private int writesInFlight;

    MonitorHandle(Sentinel sentinel, Instant startedAt) {
        this.sentinel  = sentinel;
        this.startedAt = startedAt;
    }

    public Sentinel sentinel()      { return sentinel; }
    public String runId()           { return runId; }
    public AgentLoopState state()   { return state; }
    public long cyclesExecuted()    { return cycles.get(); }

    public boolean isRunning() {
        return state == AgentLoopState.RUNNING;
    }

    /** First caller wins; used to make {@code start} idempotent under races. */
    synchronized boolean claimStart() {
        if (attached || stopped) return false;
        attached = true;
        return true;
    }

    void attach(Disposable subscription) {
        this.subscription = subscription;
        boolean stopRequested;
        synchronized (this) {
            stopRequested = stopped;
        }
        if (stopRequested) {
            subscription.dispose();
        }
    }

    void cycleCompleted(ActivityOutcome outcome) {
        cycles.incrementAndGet();
        lastOutcome = outcome;
    }

    // ── write gate ────────────────────────────────────────────────────────────

    @Override
    public synchronized boolean tryBeginWrite() {
        if (stopped) return false;
        writesInFlight++;
        return true;
    }

    @Override
    public synchronized void endWrite() {
        writesInFlight--;
        notifyAll();
    }

    // ── termination ───────────────────────────────────────────────────────────

    /**
     * Refuses further writes, waits up to {@code writeGrace} for a write in progress, then
     * cancels the loop. Blocks the calling thread; never call it from a Reactor thread.
     */
    void stop(Duration writeGrace) {
        synchronized (this) {
            if (!stopped) {
                stopped = true;
                state = AgentLoopState.STOPPED;
            }
            long deadline = System.nanoTime() + writeGrace.toNanos();
            while (writesInFlight > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.warn("Stop proceeded with a write still in flight. sentinelId={} runId={}",
                             sentinel.id(), runId);
                    break;
                }
                try {
                    wait(Math.max(1, remaining / 1_000_000));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        dispose();
    }

    /** Auto-pause from inside the loop. No write is in flight at that point. */
    void pause() {
        synchronized (this) {
            stopped = true;
            state = AgentLoopState.PAUSED_INSUFFICIENT_FUNDS;
        }
    }

    void dispose() {
        Disposable current = subscription;
        if (current != null && !current.isDisposed()) {
            current.dispose();
        }
    }

    public AgentStatus status() {
        return new AgentStatus(sentinel.id(), state, runId, startedAt, cycles.get(), lastOutcome);
    }
}
