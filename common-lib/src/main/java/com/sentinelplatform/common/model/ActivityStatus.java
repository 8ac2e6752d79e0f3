package com.sentinelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityStatus {
    SUCCESS("success"),
    FAILED("failed");

    private final String wireValue;

    ActivityStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
