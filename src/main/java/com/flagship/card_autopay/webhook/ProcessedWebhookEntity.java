package com.flagship.card_autopay.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Maps to {@code processed_webhook_events}. The event id is the primary key, so a second
 * insert for the same event fails.
 */
@Entity
@Table(
    name = "processed_webhook_events",
    indexes = {
        @Index(name = "idx_processed_webhook_payment_id", columnList = "payment_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProcessedWebhookEntity {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false, length = 100)
    private String eventId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    private String eventType;

    @Column(name = "payment_id", updatable = false)
    private UUID paymentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private WebhookOutcome outcome;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String detail;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    static ProcessedWebhookEntity fromDomain(ProcessedWebhook record) {
        return new ProcessedWebhookEntity(
            record.getEventId(),
            record.getEventType(),
            record.getPaymentId(),
            record.getOutcome(),
            record.getDetail(),
            record.getProcessedAt()
        );
    }

    public ProcessedWebhook toDomain() {
        return new ProcessedWebhook(eventId, eventType, paymentId, outcome, detail, processedAt);
    }
}
