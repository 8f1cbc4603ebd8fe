package com.flagship.card_autopay.notification;

import com.flagship.card_autopay.observability.AutopayMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the notification outbox and publishes each row to Kafka, keyed by card id.
 *
 * A row that fails to send is retried on later polls until it reaches
 * {@code autopay.notifications.publisher.max-retries}; after that it stays in the table as a
 * dead letter and is reported by the backlog health indicator.
 */
@Component
@ConditionalOnProperty(name = "autopay.notifications.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class NotificationPublisher {

    private final NotificationOutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AutopayMetrics metrics;

    @Value("${autopay.notifications.topic:card-autopay-notifications}")
    private String topic;

    @Value("${autopay.notifications.publisher.batch-size:100}")
    private int batchSize;

    @Value("${autopay.notifications.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${autopay.notifications.publisher.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${autopay.notifications.publisher.poll-interval-ms:1000}")
    public void publishPending() {
        try {
            List<NotificationOutboxEntity> batch = outboxService.findPublishable(maxRetries, batchSize);
            if (batch.isEmpty()) {
                return;
            }
            log.debug("Publishing {} queued notifications", batch.size());
            batch.forEach(this::publish);
        } catch (Exception e) {
            log.error("Notification publisher poll failed", e);
        }
    }

    private void publish(NotificationOutboxEntity row) {
        try {
            SendResult<String, String> result = kafkaTemplate
                .send(topic, row.getCardId().toString(), row.getPayload())
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            outboxService.markPublished(row.getId());
            metrics.recordNotificationPublished(row.getNotificationType());
            log.debug("Published notification {} to {}-{}@{}", row.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(row.getId(), "interrupted");
        } catch (Exception e) {
            log.warn("Failed to publish notification {} (attempt {}): {}",
                row.getId(), row.getRetryCount() + 1, e.getMessage());
            outboxService.markFailed(row.getId(), e.getMessage());
            metrics.recordNotificationPublishFailed(row.getNotificationType());
        }
    }
}
