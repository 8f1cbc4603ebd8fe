package com.flagship.card_autopay.webhook;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable record that a webhook event id has been handled, and how.
 */
@Value
public class ProcessedWebhook {
    String eventId;
    String eventType;
    UUID paymentId;
    WebhookOutcome outcome;
    String detail;
    Instant processedAt;

    public static ProcessedWebhook of(WebhookEvent event, UUID paymentId, WebhookOutcome outcome, String detail) {
        return new ProcessedWebhook(event.getEventId(), event.getRawType(), paymentId, outcome, detail, Instant.now());
    }
}
