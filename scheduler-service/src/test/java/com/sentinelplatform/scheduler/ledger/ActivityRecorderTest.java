package com.sentinelplatform.scheduler.ledger;

import com.sentinelplatform.common.model.ActivityOutcome;
import com.sentinelplatform.common.model.ErrorKind;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;
import com.sentinelplatform.common.model.Sentinel;
import com.sentinelplatform.common.model.TriggerCondition;
import com.sentinelplatform.scheduler.persistence.ActivityRow;
import com.sentinelplatform.scheduler.persistence.PersistenceGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ActivityRecorderTest {

    private static final Duration WRITE_TIMEOUT = Duration.ofSeconds(3);

    @Mock PersistenceGateway gateway;

    private ActivityRecorder recorder;

    private final Sentinel sentinel = new Sentinel("s-1", "u-1", "Wallet1", new BigDecimal("150"),
        TriggerCondition.ABOVE, PaymentToken.USDC, NetworkType.DEVNET, true, null, Instant.EPOCH);

    private final ActivityOutcome outcome = ActivityOutcome.success(new BigDecimal("200"), new BigDecimal("0.0001"),
        300L, PaymentToken.USDC, "sig", true, Instant.EPOCH);

    @BeforeEach
    void setUp() {
        recorder = new ActivityRecorder(gateway, 1000, WRITE_TIMEOUT);
    }

    @Test
    @DisplayName("open gate → row written, id returned")
    void written() {
        when(gateway.createActivity(any())).thenReturn(Mono.just("a-1"));

        StepVerifier.create(recorder.record(sentinel, outcome, WriteGate.OPEN))
            .expectNext(Optional.of("a-1"))
            .verifyComplete();
        verify(gateway).createActivity(argThat(row ->
            "s-1".equals(row.getSentinelId()) && "usdc".equals(row.getPaymentMethod()) && row.isSuccess()));
    }

    @Test
    @DisplayName("closed gate → nothing written")
    void refused() {
        WriteGate closed = new WriteGate() {
            @Override public boolean tryBeginWrite() { return false; }
            @Override public void endWrite() { fail("endWrite without begin"); }
        };

        StepVerifier.create(recorder.record(sentinel, outcome, closed))
            .expectNext(Optional.empty())
            .verifyComplete();
        verifyNoInteractions(gateway);
    }

    @Test
    @DisplayName("persistence failure → swallowed, gate released")
    void failureSwallowed() {
        AtomicInteger open = new AtomicInteger();
        WriteGate counting = new WriteGate() {
            @Override public boolean tryBeginWrite() { open.incrementAndGet(); return true; }
            @Override public void endWrite() { open.decrementAndGet(); }
        };
        when(gateway.createActivity(any())).thenReturn(Mono.error(new IllegalStateException("db down")));

        StepVerifier.create(recorder.record(sentinel, outcome, counting))
            .expectNext(Optional.empty())
            .verifyComplete();
        assertEquals(0, open.get());
    }

    @Test
    @DisplayName("write running past the timeout → cancelled, swallowed, gate released")
    void slowWriteCancelled() {
        AtomicInteger open = new AtomicInteger();
        AtomicBoolean cancelled = new AtomicBoolean();
        WriteGate counting = new WriteGate() {
            @Override public boolean tryBeginWrite() { open.incrementAndGet(); return true; }
            @Override public void endWrite() { open.decrementAndGet(); }
        };
        when(gateway.createActivity(any())).thenReturn(Mono.<String>never().doOnCancel(() -> cancelled.set(true)));

        StepVerifier.withVirtualTime(() -> recorder.record(sentinel, outcome, counting))
            .expectSubscription()
            .expectNoEvent(WRITE_TIMEOUT.minusMillis(1))
            .thenAwait(Duration.ofMillis(1))
            .expectNext(Optional.empty())
            .verifyComplete();
        assertTrue(cancelled.get());
        assertEquals(0, open.get());
    }

    @Test
    @DisplayName("stats sum spend, alerts and success rate over the window")
    void stats() {
        when(gateway.listActivities("s-1", 1000)).thenReturn(Flux.just(
            row("success", "0.0001", true, 3),
            row("success", "0.0001", false, 2),
            row("failed", "0", false, 1),
            row("failed", "0.0001", false, 0)));

        StepVerifier.create(recorder.stats("s-1"))
            .assertNext(stats -> {
                assertEquals(4, stats.totalChecks());
                assertEquals(0, new BigDecimal("0.0003").compareTo(stats.totalSpent()));
                assertEquals(1, stats.alertsTriggered());
                assertEquals(0.5, stats.successRate(), 1e-9);
                assertEquals(0, new BigDecimal("0.000075").compareTo(stats.averageCost()));
                assertEquals(Instant.parse("2026-01-01T00:03:00Z"), stats.lastCheck());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("no activity → zeroed stats")
    void emptyStats() {
        ActivityStats stats = ActivityRecorder.summarize("s-1", List.of());

        assertEquals(0, stats.totalChecks());
        assertEquals(0.0, stats.successRate());
        assertNull(stats.lastCheck());
    }

    @Test
    @DisplayName("failed outcome maps error message and zero price")
    void failureRow() {
        ActivityOutcome failed = ActivityOutcome.failure(BigDecimal.ZERO, PaymentToken.USDC, null,
            ErrorKind.INSUFFICIENT_FUNDS, "Insufficient USDC balance", Instant.EPOCH);

        ActivityRow row = ActivityRow.of(sentinel, failed);

        assertFalse(row.isSuccess());
        assertEquals("failed", row.getStatus());
        assertEquals("Insufficient USDC balance", row.getErrorMessage());
        assertEquals(0, BigDecimal.ZERO.compareTo(row.getPrice()));
        assertFalse(row.getTriggered());
    }

    private static ActivityRow row(String status, String cost, boolean triggered, int minute) {
        ActivityRow row = new ActivityRow();
        row.setStatus(status);
        row.setCost(new BigDecimal(cost));
        row.setTriggered(triggered);
        row.setCreatedAt(OffsetDateTime.of(2026, 1, 1, 0, minute, 0, 0, ZoneOffset.UTC));
        return row;
    }
}
