package com.flagship.card_autopay.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Schedules a payment for a card. Without a date and amount the card's next automatic
 * payment is computed from its automation rules instead.
 */
@Value
@Builder
@Jacksonized
public class ScheduleRequest {

    @JsonProperty("scheduled_date")
    Instant scheduledDate;

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    public boolean isManual() {
        return scheduledDate != null || amount != null;
    }
}
