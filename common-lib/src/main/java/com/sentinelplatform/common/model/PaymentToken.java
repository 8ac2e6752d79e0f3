package com.sentinelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stablecoins a sentinel can pay the oracle fee with.
 * CASH has no devnet mint; see {@link com.sentinelplatform.common.network.NetworkProfile#supports}.
 */
public enum PaymentToken {
    USDC("usdc"),
    CASH("cash");

    private final String wireValue;

    PaymentToken(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static PaymentToken fromWire(String value) {
        if (value == null || value.isBlank()) return null;
        for (PaymentToken t : values()) {
            if (t.wireValue.equalsIgnoreCase(value.trim())) return t;
        }
        throw new IllegalArgumentException("Unknown payment token: " + value);
    }
}
