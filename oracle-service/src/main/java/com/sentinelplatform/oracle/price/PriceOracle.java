package com.sentinelplatform.oracle.price;

import reactor.core.publisher.Mono;

/**
 * Current SOL/USD price. Errors with
 * {@link com.sentinelplatform.common.exception.NetworkUnavailableException} when no source answers.
 */
public interface PriceOracle {

    Mono<PriceQuote> getCurrentPrice();
}
