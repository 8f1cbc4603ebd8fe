package com.flagship.card_autopay.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A user-facing lifecycle notification. Serialized as-is onto the notifications topic.
 */
@Value
@Builder
public class LifecycleNotification {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    NotificationType type;

    @JsonProperty("card_id")
    UUID cardId;

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("schedule_id")
    UUID scheduleId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("message")
    String message;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    public static LifecycleNotification paymentCompleted(UUID cardId, UUID paymentId, BigDecimal amount, Instant at) {
        return LifecycleNotification.builder()
            .id(UUID.randomUUID())
            .type(NotificationType.PAYMENT_COMPLETED)
            .cardId(cardId)
            .paymentId(paymentId)
            .amount(amount)
            .message("Your card payment of " + amount.toPlainString() + " was successful")
            .occurredAt(at)
            .build();
    }

    public static LifecycleNotification paymentFailed(UUID cardId, UUID paymentId, BigDecimal amount,
                                                      String reason, Instant at) {
        return LifecycleNotification.builder()
            .id(UUID.randomUUID())
            .type(NotificationType.PAYMENT_FAILED)
            .cardId(cardId)
            .paymentId(paymentId)
            .amount(amount)
            .message("Your card payment of " + amount.toPlainString() + " failed"
                + (reason != null ? ": " + reason : ""))
            .occurredAt(at)
            .build();
    }

    public static LifecycleNotification paymentReminder(UUID cardId, UUID scheduleId, BigDecimal amount,
                                                        Instant scheduledDate, Instant at) {
        return LifecycleNotification.builder()
            .id(UUID.randomUUID())
            .type(NotificationType.PAYMENT_REMINDER)
            .cardId(cardId)
            .scheduleId(scheduleId)
            .amount(amount)
            .message("A payment of " + amount.toPlainString() + " is scheduled for " + scheduledDate)
            .occurredAt(at)
            .build();
    }

    public static LifecycleNotification syncError(UUID cardId, String reason, Instant at) {
        return LifecycleNotification.builder()
            .id(UUID.randomUUID())
            .type(NotificationType.CARD_SYNC_ERROR)
            .cardId(cardId)
            .message("We could not refresh your card details" + (reason != null ? ": " + reason : ""))
            .occurredAt(at)
            .build();
    }
}
