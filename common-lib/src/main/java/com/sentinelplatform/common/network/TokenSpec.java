package com.sentinelplatform.common.network;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/** SPL mint address plus the decimals used to convert between UI amounts and base units. */
public record TokenSpec(String mint, int decimals) {

    public BigInteger toBaseUnits(BigDecimal uiAmount) {
        return uiAmount.movePointRight(decimals).setScale(0, RoundingMode.HALF_UP).toBigIntegerExact();
    }

    public BigDecimal fromBaseUnits(BigInteger baseUnits) {
        return new BigDecimal(baseUnits).movePointLeft(decimals);
    }
}
