package com.flagship.card_autopay.notification;

import com.flagship.card_autopay.observability.AutopayMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Queues notifications in the outbox; {@link NotificationPublisher} ships them to Kafka later.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxNotificationDispatcher implements NotificationDispatcher {

    private final NotificationOutboxService outboxService;
    private final AutopayMetrics metrics;

    @Override
    public void dispatch(LifecycleNotification notification) {
        String type = notification.getType().getWireName();
        try {
            outboxService.enqueue(notification);
            metrics.recordNotificationQueued(type);
        } catch (RuntimeException e) {
            metrics.recordNotificationDropped(type);
            log.warn("Dropped {} notification for card {}: {}", type, notification.getCardId(), e.getMessage());
        }
    }
}
