package com.sentinelplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries {@code sentinelId} and {@code runId} through a check cycle.
 *
 * <p>The Reactor Context is the source of truth inside pipelines. MDC is written only for the
 * duration of a single log statement via {@link #withMdc}, never left on a pooled thread.
 *
 * <pre>
 *     return TraceContextUtil.withCycle(cycle, sentinel.id(), handle.runId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String SENTINEL_ID_KEY = "sentinelId";
    public static final String RUN_ID_KEY      = "runId";

    private TraceContextUtil() {}

    public static <T> Mono<T> withCycle(Mono<T> mono, String sentinelId, String runId) {
        return mono.contextWrite(ctx -> ctx.put(SENTINEL_ID_KEY, sentinelId).put(RUN_ID_KEY, runId));
    }

    /** Returns {@code "unknown"} when absent, never {@code null}. */
    public static String getSentinelId(ContextView ctx) {
        return ctx.getOrDefault(SENTINEL_ID_KEY, "unknown");
    }

    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, "unknown");
    }

    public static void withMdc(ContextView ctx, Runnable logAction) {
        MDC.put(SENTINEL_ID_KEY, getSentinelId(ctx));
        MDC.put(RUN_ID_KEY, getRunId(ctx));
        try {
            logAction.run();
        } finally {
            MDC.remove(SENTINEL_ID_KEY);
            MDC.remove(RUN_ID_KEY);
        }
    }
}
