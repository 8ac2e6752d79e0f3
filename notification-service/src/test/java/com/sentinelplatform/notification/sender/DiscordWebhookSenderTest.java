package com.sentinelplatform.notification.sender;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelplatform.common.notification.AlertEvent;
import com.sentinelplatform.common.notification.AutoPauseEvent;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DiscordWebhookSenderTest {

    private MockWebServer server;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private String hook() {
        return server.url("/api/webhooks/1/token").toString();
    }

    @Test
    @DisplayName("alert embed carries price, threshold and difference")
    void alertEmbed() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        DiscordWebhookSender sender = new DiscordWebhookSender(WebClient.builder(), true);

        sender.sendAlert(new AlertEvent("s-1", hook(), "SOL Price Alert",
            new BigDecimal("200.456"), new BigDecimal("150"), Instant.parse("2026-01-01T00:00:00Z")));

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/api/webhooks/1/token", request.getPath());
        JsonNode embed = mapper.readTree(request.getBody().readUtf8()).path("embeds").path(0);
        assertEquals("🚨 SOL Price Alert", embed.path("title").asText());
        assertEquals(DiscordWebhookSender.ALERT_COLOR, embed.path("color").asInt());
        assertEquals("$200.46 USD", embed.path("fields").path(0).path("value").asText());
        assertEquals("$150.00 USD", embed.path("fields").path(1).path("value").asText());
        assertEquals("📈 $50.46 USD", embed.path("fields").path(2).path("value").asText());
        assertEquals("2026-01-01T00:00:00Z", embed.path("timestamp").asText());
        assertEquals(DiscordWebhookSender.FOOTER, embed.path("footer").path("text").asText());
    }

    @Test
    @DisplayName("auto-pause uses its own embed")
    void autoPauseEmbed() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        DiscordWebhookSender sender = new DiscordWebhookSender(WebClient.builder(), true);

        sender.sendAutoPause(new AutoPauseEvent("s-1", hook(), "Wallet1",
            "Insufficient funds to pay for price checks", Instant.EPOCH));

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        JsonNode embed = mapper.readTree(request.getBody().readUtf8()).path("embeds").path(0);
        assertEquals("⏸️ Sentinel Paused", embed.path("title").asText());
        assertEquals(DiscordWebhookSender.PAUSE_COLOR, embed.path("color").asInt());
        assertTrue(embed.path("description").asText().startsWith("Insufficient funds"));
        assertEquals("Wallet1", embed.path("fields").path(1).path("value").asText());
    }

    @Test
    @DisplayName("webhook failure is swallowed")
    void failureSwallowed() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500));
        DiscordWebhookSender sender = new DiscordWebhookSender(WebClient.builder(), true);

        assertDoesNotThrow(() -> sender.sendAlert(new AlertEvent("s-1", hook(), "SOL Price Alert",
            BigDecimal.TEN, BigDecimal.ONE, Instant.EPOCH)));
        assertNotNull(server.takeRequest(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("disabled → nothing posted")
    void disabled() throws Exception {
        DiscordWebhookSender sender = new DiscordWebhookSender(WebClient.builder(), false);

        sender.sendAlert(new AlertEvent("s-1", hook(), "SOL Price Alert", BigDecimal.TEN, BigDecimal.ONE, Instant.EPOCH));

        assertNull(server.takeRequest(200, TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("price below threshold → downward trend")
    void downwardTrend() {
        Map<String, Object> payload = DiscordWebhookSender.alertEmbed(new AlertEvent("s-1", "https://x", "SOL Price Alert",
            new BigDecimal("140"), new BigDecimal("150"), Instant.EPOCH));

        assertTrue(payload.toString().contains("📉 $10.00 USD"));
    }
}
