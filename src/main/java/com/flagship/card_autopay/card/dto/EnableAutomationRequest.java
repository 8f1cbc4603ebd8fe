package com.flagship.card_autopay.card.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.card_autopay.card.PaymentPreference;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class EnableAutomationRequest {

    @NotNull(message = "Payment preference is required")
    @JsonProperty("payment_preference")
    PaymentPreference paymentPreference;

    /** Required when the preference is CUSTOM_AMOUNT. */
    @DecimalMin(value = "0.01", message = "Custom amount must be greater than 0")
    @JsonProperty("custom_amount")
    BigDecimal customAmount;

    @Min(value = 0, message = "Buffer hours cannot be negative")
    @Max(value = 720, message = "Buffer hours cannot exceed 720")
    @JsonProperty("buffer_hours")
    int bufferHours;
}
