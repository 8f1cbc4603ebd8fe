package com.flagship.card_autopay.notification;

import com.flagship.card_autopay.observability.AutopayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Outbox queuing and Kafka publishing, with the outbox and Kafka mocked.
 */
@ExtendWith(MockitoExtension.class)
class NotificationDeliveryTest {

    private static final String TOPIC = "card-autopay-notifications";

    @Mock
    private NotificationOutboxService outboxService;
    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;
    private SimpleMeterRegistry meterRegistry;
    private AutopayMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new AutopayMetrics(meterRegistry);
    }

    private static LifecycleNotification completed() {
        return LifecycleNotification.paymentCompleted(UUID.randomUUID(), UUID.randomUUID(),
            new BigDecimal("1000.00"), Instant.parse("2024-06-08T10:00:00Z"));
    }

    private NotificationPublisher publisher() {
        NotificationPublisher publisher = new NotificationPublisher(outboxService, kafkaTemplate, metrics);
        ReflectionTestUtils.setField(publisher, "topic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 10);
        ReflectionTestUtils.setField(publisher, "maxRetries", 5);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
        return publisher;
    }

    @Test
    @DisplayName("Dispatch queues the notification in the outbox")
    void testDispatchQueues() {
        LifecycleNotification notification = completed();

        new OutboxNotificationDispatcher(outboxService, metrics).dispatch(notification);

        verify(outboxService).enqueue(notification);
        assertEquals(1.0, meterRegistry.counter("autopay.notification.queued", "type", "payment_completed").count());
    }

    @Test
    @DisplayName("A broken outbox drops the notification instead of failing the caller")
    void testDispatchNeverThrows() {
        doThrow(new IllegalStateException("database down")).when(outboxService).enqueue(any());

        assertDoesNotThrow(() -> new OutboxNotificationDispatcher(outboxService, metrics).dispatch(completed()));
        assertEquals(1.0, meterRegistry.counter("autopay.notification.dropped", "type", "payment_completed").count());
    }

    @Test
    @DisplayName("Published rows are marked published and keyed by card id")
    void testPublishSuccess() {
        LifecycleNotification notification = completed();
        NotificationOutboxEntity row = NotificationOutboxEntity.queued(notification, "{}");
        when(outboxService.findPublishable(5, 10)).thenReturn(List.of(row));
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 1), 42L, 0, 0L, 0, 0);
        SendResult<String, String> sent = new SendResult<>(
            new ProducerRecord<>(TOPIC, notification.getCardId().toString(), "{}"), metadata);
        when(kafkaTemplate.send(TOPIC, notification.getCardId().toString(), "{}"))
            .thenReturn(CompletableFuture.completedFuture(sent));

        publisher().publishPending();

        verify(outboxService).markPublished(notification.getId());
        verify(outboxService, never()).markFailed(any(), anyString());
        assertEquals(1.0, meterRegistry.counter("autopay.notification.published", "type", "payment_completed").count());
    }

    @Test
    @DisplayName("A failed send leaves the row for retry")
    void testPublishFailure() {
        LifecycleNotification notification = completed();
        NotificationOutboxEntity row = NotificationOutboxEntity.queued(notification, "{}");
        when(outboxService.findPublishable(5, 10)).thenReturn(List.of(row));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        publisher().publishPending();

        verify(outboxService).markFailed(eq(notification.getId()), anyString());
        verify(outboxService, never()).markPublished(any());
        assertEquals(1.0,
            meterRegistry.counter("autopay.notification.publish_failed", "type", "payment_completed").count());
    }
}
