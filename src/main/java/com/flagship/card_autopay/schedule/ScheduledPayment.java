package com.flagship.card_autopay.schedule;

import com.flagship.card_autopay.card.PaymentPreference;
import com.flagship.card_autopay.payment.PaymentType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A materialized future payment intent. It becomes a PENDING payment when fired, or is
 * deleted when cancelled.
 */
@Value
@Builder(toBuilder = true)
public class ScheduledPayment {
    UUID scheduleId;
    UUID cardId;
    Instant scheduledDate;
    BigDecimal scheduledAmount;
    PaymentType paymentType;
    PaymentPreference preference;
    Instant dueDate;
    Instant reminderSentAt;
    Instant createdAt;

    public boolean isDue(Instant now) {
        return !now.isBefore(scheduledDate);
    }

    public boolean isAutomatic() {
        return paymentType == PaymentType.AUTOMATIC;
    }
}
