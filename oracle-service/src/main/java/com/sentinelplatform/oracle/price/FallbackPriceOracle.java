package com.sentinelplatform.oracle.price;

import com.sentinelplatform.common.exception.NetworkUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Price chain: cached CoinMarketCap quote → live CoinMarketCap → CoinGecko.
 *
 * <p>When both upstreams fail the oracle errors with {@link NetworkUnavailableException}
 * unless {@code oracle.price.simulated-fallback} is on, in which case it answers with a
 * simulated price in [190, 210). Simulated prices are for devnet demos only.
 */
@Service
public class FallbackPriceOracle implements PriceOracle {

    private static final Logger log = LoggerFactory.getLogger(FallbackPriceOracle.class);

    private final CoinMarketCapClient primary;
    private final CoinGeckoClient secondary;
    private final PriceCache cache;
    private final boolean simulatedFallback;

    public FallbackPriceOracle(CoinMarketCapClient primary,
                               CoinGeckoClient secondary,
                               PriceCache cache,
                               @Value("${oracle.price.simulated-fallback:false}") boolean simulatedFallback) {
        this.primary           = primary;
        this.secondary         = secondary;
        this.cache             = cache;
        this.simulatedFallback = simulatedFallback;
    }

    @Override
    public Mono<PriceQuote> getCurrentPrice() {
        return Mono.defer(() -> {
            PriceQuote cached = cache.get();
            if (cached != null) {
                log.debug("CACHE_HIT source={} fetchedAt={}", cached.source(), cached.fetchedAt());
                return Mono.just(cached);
            }
            return primary.fetchPrice()
                .doOnSuccess(cache::put)
                .onErrorResume(e -> {
                    log.warn("Primary price source failed, trying {}. reason={}", secondary.name(), e.getMessage());
                    return secondary.fetchPrice();
                })
                .onErrorResume(e -> {
                    if (simulatedFallback) {
                        PriceQuote simulated = simulate();
                        log.warn("All price sources failed, using simulated price={}. reason={}",
                                 simulated.price(), e.getMessage());
                        return Mono.just(simulated);
                    }
                    return Mono.error(new NetworkUnavailableException("No price source available", e));
                });
        });
    }

    private static PriceQuote simulate() {
        double raw = ThreadLocalRandom.current().nextDouble(190, 210);
        return new PriceQuote(BigDecimal.valueOf(raw).setScale(2, RoundingMode.HALF_UP), "simulated", Instant.now());
    }
}
