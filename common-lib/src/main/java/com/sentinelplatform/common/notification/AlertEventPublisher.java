package com.sentinelplatform.common.notification;

/**
 * Outbound side of the notifier contract.
 *
 * <p>Implementations MUST be non-blocking and fire-and-forget: a delivery failure is logged
 * by the implementation and never reaches the caller. No {@code .block()} inside.
 */
public interface AlertEventPublisher {

    void publishAlert(AlertEvent event);

    void publishAutoPause(AutoPauseEvent event);
}
