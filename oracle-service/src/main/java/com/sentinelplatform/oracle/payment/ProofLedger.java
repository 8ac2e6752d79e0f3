package com.sentinelplatform.oracle.payment;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory set of consumed payment signatures. One signature buys one check.
 *
 * <p>Entries live for {@code oracle.payment.proof-ttl}; the verifier rejects transactions
 * older than the same window, so an evicted signature can never be replayed.
 */
@Component
public class ProofLedger {

    private final Map<String, Instant> consumed = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public ProofLedger(@Value("${oracle.payment.proof-ttl:10m}") Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    ProofLedger(Duration ttl, Clock clock) {
        this.ttl   = ttl;
        this.clock = clock;
    }

    public Duration ttl() {
        return ttl;
    }

    /** Reserves the signature. Returns {@code false} if it is already reserved or consumed. */
    public boolean reserve(String signature) {
        evictExpired();
        return consumed.putIfAbsent(signature, Instant.now(clock)) == null;
    }

    /** Gives a reservation back after a failed verification so a corrected retry is possible. */
    public void release(String signature) {
        consumed.remove(signature);
    }

    public int size() {
        return consumed.size();
    }

    private void evictExpired() {
        Instant cutoff = Instant.now(clock).minus(ttl);
        consumed.values().removeIf(at -> at.isBefore(cutoff));
    }
}
