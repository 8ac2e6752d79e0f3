package com.sentinelplatform.scheduler.monitor;

/**
 * {@code MULTI}: any number of agents per user run at once.
 * {@code SINGLE}: starting an agent stops and deactivates the user's other agents on the same network.
 */
public enum ExclusivityMode {
    MULTI,
    SINGLE;

    public static ExclusivityMode fromConfig(String value) {
        return "single".equalsIgnoreCase(value == null ? "" : value.trim()) ? SINGLE : MULTI;
    }
}
