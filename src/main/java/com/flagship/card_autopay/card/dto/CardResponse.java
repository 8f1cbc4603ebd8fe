package com.flagship.card_autopay.card.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.card_autopay.card.Card;
import com.flagship.card_autopay.card.ConnectionStatus;
import com.flagship.card_autopay.card.PaymentPreference;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class CardResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("issuing_bank")
    String issuingBank;

    @JsonProperty("network_brand")
    String networkBrand;

    @JsonProperty("last4")
    String last4;

    @JsonProperty("credit_limit")
    BigDecimal creditLimit;

    @JsonProperty("current_balance")
    BigDecimal currentBalance;

    @JsonProperty("minimum_due")
    BigDecimal minimumDue;

    @JsonProperty("total_due")
    BigDecimal totalDue;

    @JsonProperty("payment_due_date")
    Instant paymentDueDate;

    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @JsonProperty("late_fee_amount")
    BigDecimal lateFeeAmount;

    @JsonProperty("automation_enabled")
    boolean automationEnabled;

    @JsonProperty("payment_preference")
    PaymentPreference paymentPreference;

    @JsonProperty("custom_amount")
    BigDecimal customAmount;

    @JsonProperty("buffer_hours")
    int bufferHours;

    @JsonProperty("connection_status")
    ConnectionStatus connectionStatus;

    @JsonProperty("last_sync")
    Instant lastSync;

    @JsonProperty("last_sync_error")
    String lastSyncError;

    public static CardResponse from(Card card) {
        return CardResponse.builder()
            .id(card.getId())
            .issuingBank(card.getIssuingBank())
            .networkBrand(card.getNetworkBrand())
            .last4(card.getLast4())
            .creditLimit(card.getCreditLimit())
            .currentBalance(card.getCurrentBalance())
            .minimumDue(card.getMinimumDue())
            .totalDue(card.getTotalDue())
            .paymentDueDate(card.getPaymentDueDate())
            .interestRate(card.getInterestRate())
            .lateFeeAmount(card.getLateFeeAmount())
            .automationEnabled(card.isAutomationEnabled())
            .paymentPreference(card.getPaymentPreference())
            .customAmount(card.getCustomAmount())
            .bufferHours(card.getBufferHours())
            .connectionStatus(card.getConnectionStatus())
            .lastSync(card.getLastSync())
            .lastSyncError(card.getLastSyncError())
            .build();
    }
}
