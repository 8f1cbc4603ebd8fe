package com.flagship.card_autopay.payment;

import com.flagship.card_autopay.card.PaymentPreference;
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
 * JPA mapping for {@link Payment}.
 *
 * Unique constraints back the lifecycle invariants: one payment per schedule, one per
 * idempotency key, and a transaction id attached to at most one payment.
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_card_id", columnList = "card_id"),
        @Index(name = "idx_payments_status", columnList = "status"),
        @Index(name = "idx_payments_gateway_order_id", columnList = "gateway_order_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "card_id", nullable = false, updatable = false)
    private UUID cardId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private PaymentPreference preference;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false, updatable = false, length = 20)
    private PaymentType paymentType;

    @Column(name = "schedule_id", unique = true, updatable = false)
    private UUID scheduleId;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "gateway_order_id")
    private String gatewayOrderId;

    @Column(name = "transaction_id", unique = true)
    private String transactionId;

    @Column(name = "due_date", updatable = false)
    private Instant dueDate;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "interest_saved", nullable = false, precision = 19, scale = 4)
    private BigDecimal interestSaved;

    @Column(name = "late_fee_prevented", nullable = false, precision = 19, scale = 4)
    private BigDecimal lateFeePrevented;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PaymentEntity fromDomain(Payment payment) {
        return new PaymentEntity(
            payment.getId(),
            payment.getCardId(),
            payment.getStatus(),
            payment.getAmount(),
            payment.getPreference(),
            payment.getPaymentType(),
            payment.getScheduleId(),
            payment.getIdempotencyKey(),
            payment.getGatewayOrderId(),
            payment.getTransactionId(),
            payment.getDueDate(),
            payment.getFailureReason(),
            payment.getLastError(),
            payment.getInterestSaved(),
            payment.getLateFeePrevented(),
            null, // createdAt - set by @PrePersist
            null, // updatedAt - set by @PrePersist
            payment.getCompletedAt(),
            null  // version - assigned by Hibernate
        );
    }

    public Payment toDomain() {
        return Payment.builder()
            .id(id)
            .cardId(cardId)
            .status(status)
            .amount(amount)
            .preference(preference)
            .paymentType(paymentType)
            .scheduleId(scheduleId)
            .idempotencyKey(idempotencyKey)
            .gatewayOrderId(gatewayOrderId)
            .transactionId(transactionId)
            .dueDate(dueDate)
            .failureReason(failureReason)
            .lastError(lastError)
            .interestSaved(interestSaved)
            .lateFeePrevented(lateFeePrevented)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .completedAt(completedAt)
            .version(version)
            .build();
    }

    /**
     * Copies lifecycle state. Amount, card, schedule and idempotency key never change after insert.
     */
    void updateFromDomain(Payment payment) {
        this.status = payment.getStatus();
        this.gatewayOrderId = payment.getGatewayOrderId();
        this.transactionId = payment.getTransactionId();
        this.failureReason = payment.getFailureReason();
        this.lastError = payment.getLastError();
        this.interestSaved = payment.getInterestSaved();
        this.lateFeePrevented = payment.getLateFeePrevented();
        this.completedAt = payment.getCompletedAt();
    }
}
