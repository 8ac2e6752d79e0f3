package com.sentinelplatform.scheduler.client;

import com.sentinelplatform.common.model.Sentinel;
import reactor.core.publisher.Mono;

/**
 * Runs one paid price check for a sentinel. The returned {@link Mono} never errors for
 * check failures: they come back as a FAILED {@link CheckResult}.
 */
public interface PriceCheckClient {

    Mono<CheckResult> check(Sentinel sentinel);
}
