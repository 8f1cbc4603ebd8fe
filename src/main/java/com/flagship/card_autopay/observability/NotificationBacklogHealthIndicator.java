package com.flagship.card_autopay.observability;

import com.flagship.card_autopay.notification.NotificationOutboxService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the notification outbox backlog. Notifications are best-effort, so a large backlog
 * degrades to WARNING and only dead letters push the indicator DOWN.
 */
@Component("notificationOutbox")
public class NotificationBacklogHealthIndicator implements HealthIndicator {

    private static final long BACKLOG_WARNING_THRESHOLD = 1000;

    private final NotificationOutboxService outboxService;
    private final int maxRetries;

    public NotificationBacklogHealthIndicator(NotificationOutboxService outboxService,
                                              AutopayMetrics metrics,
                                              @Value("${autopay.notifications.publisher.max-retries:5}") int maxRetries) {
        this.outboxService = outboxService;
        this.maxRetries = maxRetries;
        metrics.registerGauge("autopay.notification.backlog", outboxService::countUnpublished);
    }

    @Override
    public Health health() {
        try {
            long backlog = outboxService.countUnpublished();
            long deadLettered = outboxService.countDeadLettered(maxRetries);

            Health.Builder builder = deadLettered > 0
                    ? Health.down()
                    : backlog < BACKLOG_WARNING_THRESHOLD ? Health.up() : Health.status("WARNING");

            return builder
                    .withDetail("backlogSize", backlog)
                    .withDetail("deadLettered", deadLettered)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
