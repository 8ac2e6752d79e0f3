package com.sentinelplatform.common.alert;

import com.sentinelplatform.common.model.TriggerCondition;

import java.math.BigDecimal;

/**
 * Stateless threshold check shared by the oracle and tests.
 *
 * <p>Both comparisons are strict: a price equal to the threshold never fires, and a single
 * price can satisfy at most one condition.
 */
public final class AlertEvaluator {

    private AlertEvaluator() {}

    public static boolean evaluate(BigDecimal price, BigDecimal threshold, TriggerCondition condition) {
        if (price == null || threshold == null || condition == null) {
            return false;
        }
        int cmp = price.compareTo(threshold);
        return switch (condition) {
            case ABOVE -> cmp > 0;
            case BELOW -> cmp < 0;
        };
    }
}
