package com.sentinelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction in which a price must cross the sentinel's threshold to fire an alert.
 * Serialised as {@code "above"} / {@code "below"}.
 */
public enum TriggerCondition {
    ABOVE("above"),
    BELOW("below");

    private final String wireValue;

    TriggerCondition(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** Lenient parse; unknown or blank values yield {@code null} so the evaluator never triggers. */
    @JsonCreator
    public static TriggerCondition fromWire(String value) {
        if (value == null) return null;
        for (TriggerCondition c : values()) {
            if (c.wireValue.equalsIgnoreCase(value.trim())) return c;
        }
        return null;
    }
}
