package com.flagship.card_autopay.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.card_autopay.card.PaymentPreference;
import com.flagship.card_autopay.payment.Payment;
import com.flagship.card_autopay.payment.PaymentStatus;
import com.flagship.card_autopay.payment.PaymentType;
import com.flagship.card_autopay.schedule.ScheduledPayment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for payments. Scheduled intents are rendered in the same shape with status
 * SCHEDULED so the upcoming list reads as one timeline.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("card_id")
    UUID cardId;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("preference")
    PaymentPreference preference;

    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("schedule_id")
    UUID scheduleId;

    @JsonProperty("scheduled_date")
    Instant scheduledDate;

    @JsonProperty("due_date")
    Instant dueDate;

    @JsonProperty("gateway_order_id")
    String gatewayOrderId;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("last_error")
    String lastError;

    @JsonProperty("interest_saved")
    BigDecimal interestSaved;

    @JsonProperty("late_fee_prevented")
    BigDecimal lateFeePrevented;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .cardId(payment.getCardId())
            .status(payment.getStatus())
            .amount(payment.getAmount())
            .preference(payment.getPreference())
            .paymentType(payment.getPaymentType())
            .scheduleId(payment.getScheduleId())
            .dueDate(payment.getDueDate())
            .gatewayOrderId(payment.getGatewayOrderId())
            .transactionId(payment.getTransactionId())
            .failureReason(payment.getFailureReason())
            .lastError(payment.getLastError())
            .interestSaved(payment.getInterestSaved())
            .lateFeePrevented(payment.getLateFeePrevented())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .completedAt(payment.getCompletedAt())
            .build();
    }

    public static PaymentResponse from(ScheduledPayment schedule) {
        return PaymentResponse.builder()
            .id(schedule.getScheduleId())
            .cardId(schedule.getCardId())
            .status(PaymentStatus.SCHEDULED)
            .amount(schedule.getScheduledAmount())
            .preference(schedule.getPreference())
            .paymentType(schedule.getPaymentType())
            .scheduleId(schedule.getScheduleId())
            .scheduledDate(schedule.getScheduledDate())
            .dueDate(schedule.getDueDate())
            .createdAt(schedule.getCreatedAt())
            .build();
    }
}
