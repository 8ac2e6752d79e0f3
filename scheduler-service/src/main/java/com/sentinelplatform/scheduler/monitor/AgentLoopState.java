package com.sentinelplatform.scheduler.monitor;

/**
 * Per-agent loop lifecycle.
 * <pre>
 * STOPPED → RUNNING → STOPPED
 *              └────→ PAUSED_INSUFFICIENT_FUNDS
 * </pre>
 */
public enum AgentLoopState {
    STOPPED,
    RUNNING,
    PAUSED_INSUFFICIENT_FUNDS
}
