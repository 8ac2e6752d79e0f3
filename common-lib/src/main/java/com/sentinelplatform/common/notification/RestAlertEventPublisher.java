package com.sentinelplatform.common.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Posts notices to notification-service over HTTP, fire-and-forget.
 *
 * <p>Failures are logged at WARN and dropped; they never fail the check that produced them.
 * Each service declares its own bean with a {@code notificationClient} pointed at
 * {@code services.notification.base-url}.
 */
public class RestAlertEventPublisher implements AlertEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestAlertEventPublisher.class);

    private final WebClient notificationClient;

    public RestAlertEventPublisher(WebClient notificationClient) {
        this.notificationClient = notificationClient;
    }

    @Override
    public void publishAlert(AlertEvent event) {
        post("/api/v1/notify/alert", event, event.sentinelId(), "alert");
    }

    @Override
    public void publishAutoPause(AutoPauseEvent event) {
        post("/api/v1/notify/auto-pause", event, event.sentinelId(), "auto-pause");
    }

    private void post(String path, Object payload, String sentinelId, String kind) {
        notificationClient.post()
            .uri(path)
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Notice published. kind={} sentinelId={} status={}",
                                kind, sentinelId, r.getStatusCode()),
                err -> log.warn("Notice publish failed (non-critical). kind={} sentinelId={}",
                                kind, sentinelId, err)
            );
    }
}
