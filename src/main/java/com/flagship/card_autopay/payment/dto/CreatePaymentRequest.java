package com.flagship.card_autopay.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.card_autopay.card.PaymentPreference;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request DTO for an immediate payment. When {@code amount} is absent the card's
 * {@code preference} decides it.
 */
@Value
@Builder
@Jacksonized
public class CreatePaymentRequest {

    @NotNull(message = "Card ID is required")
    @JsonProperty("card_id")
    UUID cardId;

    @NotNull(message = "Payment preference is required")
    @JsonProperty("preference")
    PaymentPreference preference;

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    /** Submit to the gateway right away; defaults to true. */
    @JsonProperty("submit")
    Boolean submit;

    public boolean shouldSubmit() {
        return submit == null || submit;
    }
}
