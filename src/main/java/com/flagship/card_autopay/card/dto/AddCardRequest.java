package com.flagship.card_autopay.card.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Bound through a Jacksonized builder so the snake_case names apply on input.
 */
@Value
@Builder
@Jacksonized
public class AddCardRequest {

    @NotBlank(message = "Issuing bank is required")
    @JsonProperty("issuing_bank")
    String issuingBank;

    @NotBlank(message = "Network brand is required")
    @JsonProperty("network_brand")
    String networkBrand;

    @NotNull(message = "Last four digits are required")
    @Pattern(regexp = "^\\d{4}$", message = "last4 must be exactly four digits")
    @JsonProperty("last4")
    String last4;

    @NotNull(message = "Credit limit is required")
    @DecimalMin(value = "0.01", message = "Credit limit must be greater than 0")
    @JsonProperty("credit_limit")
    BigDecimal creditLimit;

    /** Annual rate in percent; defaults to 42.00 when absent. */
    @DecimalMin(value = "0.00", message = "Interest rate cannot be negative")
    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @DecimalMin(value = "0.00", message = "Late fee cannot be negative")
    @JsonProperty("late_fee_amount")
    BigDecimal lateFeeAmount;
}
