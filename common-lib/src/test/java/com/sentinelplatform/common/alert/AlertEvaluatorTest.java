package com.sentinelplatform.common.alert;

import com.sentinelplatform.common.model.TriggerCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AlertEvaluatorTest {

    private static final BigDecimal THRESHOLD = new BigDecimal("200");

    // ── above ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("ABOVE")
    class Above {

        @Test
        @DisplayName("price over threshold → triggers")
        void priceOver() {
            assertTrue(AlertEvaluator.evaluate(new BigDecimal("201"), THRESHOLD, TriggerCondition.ABOVE));
        }

        @Test
        @DisplayName("price equal to threshold → no trigger")
        void priceEqual() {
            assertFalse(AlertEvaluator.evaluate(new BigDecimal("200.00"), THRESHOLD, TriggerCondition.ABOVE));
        }

        @Test
        @DisplayName("price under threshold → no trigger")
        void priceUnder() {
            assertFalse(AlertEvaluator.evaluate(new BigDecimal("199.99"), THRESHOLD, TriggerCondition.ABOVE));
        }
    }

    // ── below ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("BELOW")
    class Below {

        @Test
        @DisplayName("price under threshold → triggers")
        void priceUnder() {
            assertTrue(AlertEvaluator.evaluate(new BigDecimal("150"), THRESHOLD, TriggerCondition.BELOW));
        }

        @Test
        @DisplayName("price equal to threshold → no trigger")
        void priceEqual() {
            assertFalse(AlertEvaluator.evaluate(THRESHOLD, THRESHOLD, TriggerCondition.BELOW));
        }
    }

    @Test
    @DisplayName("a single price never satisfies both conditions")
    void neverBoth() {
        for (String p : new String[]{"0.01", "199.999", "200", "200.001", "10000"}) {
            BigDecimal price = new BigDecimal(p);
            boolean above = AlertEvaluator.evaluate(price, THRESHOLD, TriggerCondition.ABOVE);
            boolean below = AlertEvaluator.evaluate(price, THRESHOLD, TriggerCondition.BELOW);
            assertFalse(above && below, "both fired for price " + p);
        }
    }

    @Test
    @DisplayName("unknown condition → never triggers")
    void unknownCondition() {
        assertNull(TriggerCondition.fromWire("sideways"));
        assertFalse(AlertEvaluator.evaluate(new BigDecimal("500"), THRESHOLD, TriggerCondition.fromWire("sideways")));
    }
}
