package com.sentinelplatform.notification.sender;

import com.sentinelplatform.common.notification.AlertEvent;
import com.sentinelplatform.common.notification.AutoPauseEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Posts Discord webhook embeds. Delivery is fire-and-forget: failures are logged, never
 * returned to the caller.
 */
@Component
public class DiscordWebhookSender {

    private static final Logger log = LoggerFactory.getLogger(DiscordWebhookSender.class);

    static final int ALERT_COLOR = 0xFF0000;
    static final int PAUSE_COLOR = 0xFFA500;
    static final String FOOTER   = "⚡ Sentinel Price Alert System";

    private final WebClient webClient;
    private final boolean discordEnabled;

    public DiscordWebhookSender(WebClient.Builder builder,
                                @Value("${notification.discord.enabled:true}") boolean discordEnabled) {
        this.webClient      = builder.build();
        this.discordEnabled = discordEnabled;
    }

    public void sendAlert(AlertEvent event) {
        if (!discordEnabled) {
            log.info("Discord disabled. Logging alert instead. sentinelId={} price={} threshold={}",
                     event.sentinelId(), event.price(), event.threshold());
            return;
        }
        post(event.target(), alertEmbed(event), event.sentinelId(), "alert");
    }

    public void sendAutoPause(AutoPauseEvent event) {
        if (!discordEnabled) {
            log.info("Discord disabled. Logging auto-pause instead. sentinelId={} wallet={} reason={}",
                     event.sentinelId(), event.walletAddress(), event.reason());
            return;
        }
        post(event.target(), autoPauseEmbed(event), event.sentinelId(), "auto-pause");
    }

    private void post(String webhookUrl, Map<String, Object> payload, String sentinelId, String kind) {
        webClient.post()
            .uri(webhookUrl)
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Discord notification sent. kind={} sentinelId={} status={}",
                                kind, sentinelId, r.getStatusCode()),
                err -> log.error("Discord notification failed. kind={} sentinelId={}", kind, sentinelId, err)
            );
    }

    // ── embeds ────────────────────────────────────────────────────────────────

    static Map<String, Object> alertEmbed(AlertEvent event) {
        BigDecimal price     = event.price();
        BigDecimal threshold = event.threshold();
        String trend = price.compareTo(threshold) > 0 ? "📈" : "📉";

        Map<String, Object> embed = Map.of(
            "title",       "🚨 " + event.title(),
            "description", "A price threshold has been crossed!",
            "color",       ALERT_COLOR,
            "fields", List.of(
                field("💰 Current Price", usd(price)),
                field("🎯 Threshold",     usd(threshold)),
                field("📊 Difference",    trend + " " + usd(price.subtract(threshold).abs()))),
            "timestamp",   timestamp(event.timestamp()),
            "footer",      Map.of("text", FOOTER));
        return Map.of("embeds", List.of(embed));
    }

    static Map<String, Object> autoPauseEmbed(AutoPauseEvent event) {
        Map<String, Object> embed = Map.of(
            "title",       "⏸️ Sentinel Paused",
            "description", event.reason() + ". Fund the wallet and restart the sentinel to resume monitoring.",
            "color",       PAUSE_COLOR,
            "fields", List.of(
                field("🤖 Sentinel", event.sentinelId()),
                field("👛 Wallet",   event.walletAddress())),
            "timestamp",   timestamp(event.timestamp()),
            "footer",      Map.of("text", FOOTER));
        return Map.of("embeds", List.of(embed));
    }

    private static Map<String, Object> field(String name, String value) {
        return Map.of("name", name, "value", value == null ? "-" : value, "inline", true);
    }

    private static String usd(BigDecimal amount) {
        return "$" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString() + " USD";
    }

    private static String timestamp(Instant at) {
        return (at != null ? at : Instant.now()).toString();
    }
}
