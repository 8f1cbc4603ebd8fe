package com.flagship.card_autopay.card;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping for {@link Card}.
 *
 * No setters: the entity is only ever built from, or refreshed from, a domain object.
 * {@code version} is managed by Hibernate.
 */
@Entity
@Table(
    name = "cards",
    indexes = {
        @Index(name = "idx_cards_connection_status", columnList = "connection_status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CardEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "issuing_bank", nullable = false, updatable = false, length = 100)
    private String issuingBank;

    @Column(name = "network_brand", nullable = false, updatable = false, length = 50)
    private String networkBrand;

    @Column(name = "last4", nullable = false, updatable = false, length = 4)
    private String last4;

    @Column(name = "credit_limit", precision = 19, scale = 4)
    private BigDecimal creditLimit;

    @Column(name = "current_balance", precision = 19, scale = 4)
    private BigDecimal currentBalance;

    @Column(name = "minimum_due", nullable = false, precision = 19, scale = 4)
    private BigDecimal minimumDue;

    @Column(name = "total_due", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalDue;

    @Column(name = "payment_due_date")
    private Instant paymentDueDate;

    @Column(name = "interest_rate", nullable = false, precision = 7, scale = 4)
    private BigDecimal interestRate;

    @Column(name = "late_fee_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal lateFeeAmount;

    @Column(name = "automation_enabled", nullable = false)
    private boolean automationEnabled;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_preference", nullable = false, length = 20)
    private PaymentPreference paymentPreference;

    @Column(name = "custom_amount", precision = 19, scale = 4)
    private BigDecimal customAmount;

    @Column(name = "buffer_hours", nullable = false)
    private int bufferHours;

    @Enumerated(EnumType.STRING)
    @Column(name = "connection_status", nullable = false, length = 20)
    private ConnectionStatus connectionStatus;

    @Column(name = "last_sync")
    private Instant lastSync;

    @Column(name = "sync_started_at")
    private Instant syncStartedAt;

    @Column(name = "last_sync_error", columnDefinition = "TEXT")
    private String lastSyncError;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static CardEntity fromDomain(Card card) {
        return new CardEntity(
            card.getId(),
            card.getIssuingBank(),
            card.getNetworkBrand(),
            card.getLast4(),
            card.getCreditLimit(),
            card.getCurrentBalance(),
            card.getMinimumDue(),
            card.getTotalDue(),
            card.getPaymentDueDate(),
            card.getInterestRate(),
            card.getLateFeeAmount(),
            card.isAutomationEnabled(),
            card.getPaymentPreference(),
            card.getCustomAmount(),
            card.getBufferHours(),
            card.getConnectionStatus(),
            card.getLastSync(),
            card.getSyncStartedAt(),
            card.getLastSyncError(),
            null, // version - assigned by Hibernate
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Card toDomain() {
        return Card.builder()
            .id(id)
            .issuingBank(issuingBank)
            .networkBrand(networkBrand)
            .last4(last4)
            .creditLimit(creditLimit)
            .currentBalance(currentBalance)
            .minimumDue(minimumDue)
            .totalDue(totalDue)
            .paymentDueDate(paymentDueDate)
            .interestRate(interestRate)
            .lateFeeAmount(lateFeeAmount)
            .automationEnabled(automationEnabled)
            .paymentPreference(paymentPreference)
            .customAmount(customAmount)
            .bufferHours(bufferHours)
            .connectionStatus(connectionStatus)
            .lastSync(lastSync)
            .syncStartedAt(syncStartedAt)
            .lastSyncError(lastSyncError)
            .version(version)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the mutable state of {@code card}. Identity columns never change.
     */
    void updateFromDomain(Card card) {
        this.creditLimit = card.getCreditLimit();
        this.currentBalance = card.getCurrentBalance();
        this.minimumDue = card.getMinimumDue();
        this.totalDue = card.getTotalDue();
        this.paymentDueDate = card.getPaymentDueDate();
        this.interestRate = card.getInterestRate();
        this.lateFeeAmount = card.getLateFeeAmount();
        this.automationEnabled = card.isAutomationEnabled();
        this.paymentPreference = card.getPaymentPreference();
        this.customAmount = card.getCustomAmount();
        this.bufferHours = card.getBufferHours();
        this.connectionStatus = card.getConnectionStatus();
        this.lastSync = card.getLastSync();
        this.syncStartedAt = card.getSyncStartedAt();
        this.lastSyncError = card.getLastSyncError();
    }
}
