package com.sentinelplatform.oracle.payment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ProofLedgerTest {

    static class MutableClock extends Clock {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");

        @Override public ZoneOffset getZone()            { return ZoneOffset.UTC; }
        @Override public Clock withZone(java.time.ZoneId z) { return this; }
        @Override public Instant instant()               { return now; }
    }

    @Test
    @DisplayName("a signature can be reserved once until released")
    void reserveOnce() {
        ProofLedger ledger = new ProofLedger(Duration.ofMinutes(10), new MutableClock());

        assertTrue(ledger.reserve("a"));
        assertFalse(ledger.reserve("a"));
        ledger.release("a");
        assertTrue(ledger.reserve("a"));
    }

    @Test
    @DisplayName("entries older than the TTL are evicted")
    void evictsAfterTtl() {
        MutableClock clock = new MutableClock();
        ProofLedger ledger = new ProofLedger(Duration.ofMinutes(10), clock);
        ledger.reserve("a");

        clock.now = clock.now.plus(Duration.ofMinutes(11));
        ledger.reserve("b");

        assertEquals(1, ledger.size());
    }
}
