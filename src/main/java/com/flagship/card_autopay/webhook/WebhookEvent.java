package com.flagship.card_autopay.webhook;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A parsed gateway callback. Delivered at least once; {@code eventId} identifies duplicates.
 */
@Value
@Builder
public class WebhookEvent {
    String eventId;
    WebhookEventType type;
    /** Type string as sent, kept for logging unknown types. */
    String rawType;
    String orderId;
    String transactionId;
    /** Local payment id echoed back from the order notes. */
    UUID paymentReference;
    String failureReason;
    CardMetadata cardMetadata;
    Instant createdAt;
    String rawPayload;

    /**
     * Timestamp the card metadata is valid as of: its own timestamp, else the event's.
     */
    public Instant metadataTimestamp() {
        if (cardMetadata == null) {
            return null;
        }
        return cardMetadata.getUpdatedAt() != null ? cardMetadata.getUpdatedAt() : createdAt;
    }
}
