package com.sentinelplatform.notification.controller;

import com.sentinelplatform.common.notification.AlertEvent;
import com.sentinelplatform.common.notification.AutoPauseEvent;
import com.sentinelplatform.notification.sender.DiscordWebhookSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationControllerTest {

    @Mock DiscordWebhookSender sender;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new NotificationController(sender)).build();
    }

    @Test
    @DisplayName("alert → 202 and handed to the sender")
    void alertAccepted() {
        client.post().uri("/api/v1/notify/alert").contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {"sentinelId":"s-1","target":"https://discord.com/api/webhooks/1/t","title":"SOL Price Alert",
                 "price":200,"threshold":150,"timestamp":"2026-01-01T00:00:00Z"}""")
            .exchange()
            .expectStatus().isAccepted();

        ArgumentCaptor<AlertEvent> event = ArgumentCaptor.forClass(AlertEvent.class);
        verify(sender).sendAlert(event.capture());
        assertEquals(0, new BigDecimal("200").compareTo(event.getValue().price()));
    }

    @Test
    @DisplayName("alert without a webhook target → 400, nothing sent")
    void alertWithoutTarget() {
        client.post().uri("/api/v1/notify/alert").contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"sentinelId\":\"s-1\",\"title\":\"SOL Price Alert\",\"price\":200,\"threshold\":150}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody().jsonPath("$.error").exists();
        verifyNoInteractions(sender);
    }

    @Test
    @DisplayName("auto-pause → 202")
    void autoPause() {
        client.post().uri("/api/v1/notify/auto-pause").contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {"sentinelId":"s-1","target":"https://discord.com/api/webhooks/1/t","walletAddress":"W1",
                 "reason":"Insufficient funds","timestamp":"2026-01-01T00:00:00Z"}""")
            .exchange()
            .expectStatus().isAccepted();
        verify(sender).sendAutoPause(any(AutoPauseEvent.class));
    }
}
