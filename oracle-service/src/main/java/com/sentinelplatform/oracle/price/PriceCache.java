package com.sentinelplatform.oracle.price;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the last primary-source quote for a fixed TTL (5 minutes by default) so a fleet of
 * sentinels checking every 30 s stays inside the upstream rate limit.
 */
@Component
public class PriceCache {

    private static final Logger log = LoggerFactory.getLogger(PriceCache.class);

    private final AtomicReference<PriceQuote> latest = new AtomicReference<>();
    private final Duration ttl;
    private final Clock clock;

    public PriceCache(@Value("${oracle.price.cache-ttl:5m}") Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    PriceCache(Duration ttl, Clock clock) {
        this.ttl   = ttl;
        this.clock = clock;
    }

    /** The cached quote, or {@code null} if absent or expired. Expired entries are evicted. */
    public PriceQuote get() {
        PriceQuote entry = latest.get();
        if (entry == null) {
            return null;
        }
        if (Instant.now(clock).isAfter(entry.fetchedAt().plus(ttl))) {
            latest.compareAndSet(entry, null);
            return null;
        }
        return entry;
    }

    public void put(PriceQuote quote) {
        latest.set(new PriceQuote(quote.price(), quote.source(), Instant.now(clock)));
        log.info("CACHE_REFRESH source={} price={} ttlSeconds={}", quote.source(), quote.price(), ttl.toSeconds());
    }

    public void clear() {
        latest.set(null);
    }
}
