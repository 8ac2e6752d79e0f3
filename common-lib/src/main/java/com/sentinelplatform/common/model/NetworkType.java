package com.sentinelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NetworkType {
    DEVNET("devnet"),
    MAINNET("mainnet");

    private final String wireValue;

    NetworkType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** Anything other than {@code mainnet} resolves to devnet. */
    @JsonCreator
    public static NetworkType fromWire(String value) {
        if (value != null && MAINNET.wireValue.equalsIgnoreCase(value.trim())) {
            return MAINNET;
        }
        return DEVNET;
    }
}
