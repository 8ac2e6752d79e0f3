package com.sentinelplatform.oracle.price;

import reactor.core.publisher.Mono;

/** One upstream price feed. Tried in order by {@link FallbackPriceOracle}. */
public interface PriceSource {

    String name();

    Mono<PriceQuote> fetchPrice();
}
