package com.sentinelplatform.common.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;
import com.sentinelplatform.common.model.TriggerCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class CheckRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("wire enums read lower-case values")
    void readsWireValues() throws Exception {
        String json = """
            {"sentinelId":"s-1","userId":"u-1","walletAddress":"W1","threshold":150,
             "condition":"below","network":"mainnet","paymentMethod":"cash",
             "notificationTarget":"https://hook","active":true}
            """;

        CheckRequest request = mapper.readValue(json, CheckRequest.class);

        assertEquals(TriggerCondition.BELOW, request.condition());
        assertEquals(NetworkType.MAINNET, request.network());
        assertEquals(PaymentToken.CASH, request.paymentMethod());
        assertNull(request.validationError());
    }

    @Test
    @DisplayName("non-positive threshold is malformed")
    void rejectsNonPositiveThreshold() {
        CheckRequest request = new CheckRequest("s-1", "u-1", "W1", BigDecimal.ZERO,
            TriggerCondition.ABOVE, NetworkType.DEVNET, PaymentToken.USDC, null, true);

        assertEquals("threshold must be greater than zero", request.validationError());
    }

    @Test
    @DisplayName("missing condition is malformed")
    void rejectsMissingCondition() {
        CheckRequest request = new CheckRequest("s-1", "u-1", "W1", BigDecimal.TEN,
            null, NetworkType.DEVNET, PaymentToken.USDC, null, true);

        assertNotNull(request.validationError());
    }
}
