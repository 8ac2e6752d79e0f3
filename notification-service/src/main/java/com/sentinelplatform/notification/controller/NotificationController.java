package com.sentinelplatform.notification.controller;

import com.sentinelplatform.common.notification.AlertEvent;
import com.sentinelplatform.common.notification.AutoPauseEvent;
import com.sentinelplatform.notification.sender.DiscordWebhookSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/notify")
public class NotificationController {

    private static final Logger log = LoggerFactory.getLogger(NotificationController.class);

    private final DiscordWebhookSender discordSender;

    public NotificationController(DiscordWebhookSender discordSender) {
        this.discordSender = discordSender;
    }

    @PostMapping("/alert")
    public ResponseEntity<Map<String, String>> alert(@RequestBody AlertEvent event) {
        if (!isWebhook(event.target())) {
            return rejected(event.sentinelId(), "target must be an http(s) webhook URL");
        }
        if (event.price() == null || event.threshold() == null) {
            return rejected(event.sentinelId(), "price and threshold are required");
        }
        discordSender.sendAlert(event);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/auto-pause")
    public ResponseEntity<Map<String, String>> autoPause(@RequestBody AutoPauseEvent event) {
        if (!isWebhook(event.target())) {
            return rejected(event.sentinelId(), "target must be an http(s) webhook URL");
        }
        discordSender.sendAutoPause(event);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static boolean isWebhook(String target) {
        return target != null && (target.startsWith("https://") || target.startsWith("http://"));
    }

    private static ResponseEntity<Map<String, String>> rejected(String sentinelId, String reason) {
        log.warn("Notice rejected. sentinelId={} reason={}", sentinelId, reason);
        return ResponseEntity.badRequest().body(Map.of("error", reason));
    }
}
