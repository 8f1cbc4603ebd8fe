package com.flagship.card_autopay.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.card_autopay.card.PaymentPreference;
import com.flagship.card_autopay.payment.PaymentType;
import com.flagship.card_autopay.schedule.ScheduledPayment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class ScheduledPaymentResponse {

    @JsonProperty("schedule_id")
    UUID scheduleId;

    @JsonProperty("card_id")
    UUID cardId;

    @JsonProperty("scheduled_date")
    Instant scheduledDate;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("preference")
    PaymentPreference preference;

    @JsonProperty("due_date")
    Instant dueDate;

    @JsonProperty("reminder_sent_at")
    Instant reminderSentAt;

    public static ScheduledPaymentResponse from(ScheduledPayment schedule) {
        return new ScheduledPaymentResponse(
            schedule.getScheduleId(),
            schedule.getCardId(),
            schedule.getScheduledDate(),
            schedule.getScheduledAmount(),
            schedule.getPaymentType(),
            schedule.getPreference(),
            schedule.getDueDate(),
            schedule.getReminderSentAt()
        );
    }
}
