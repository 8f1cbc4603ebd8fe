package com.flagship.card_autopay.schedule;

import com.flagship.card_autopay.card.PaymentPreference;
import com.flagship.card_autopay.payment.PaymentType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "scheduled_payments",
    indexes = {
        @Index(name = "idx_scheduled_payments_card_id", columnList = "card_id"),
        @Index(name = "idx_scheduled_payments_scheduled_date", columnList = "scheduled_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScheduledPaymentEntity {

    @Id
    @Column(name = "schedule_id", nullable = false, updatable = false)
    private UUID scheduleId;

    @Column(name = "card_id", nullable = false, updatable = false)
    private UUID cardId;

    @Column(name = "scheduled_date", nullable = false, updatable = false)
    private Instant scheduledDate;

    @Column(name = "scheduled_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal scheduledAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false, updatable = false, length = 20)
    private PaymentType paymentType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private PaymentPreference preference;

    @Column(name = "due_date", updatable = false)
    private Instant dueDate;

    @Column(name = "reminder_sent_at")
    private Instant reminderSentAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static ScheduledPaymentEntity fromDomain(ScheduledPayment schedule) {
        return new ScheduledPaymentEntity(
            schedule.getScheduleId(),
            schedule.getCardId(),
            schedule.getScheduledDate(),
            schedule.getScheduledAmount(),
            schedule.getPaymentType(),
            schedule.getPreference(),
            schedule.getDueDate(),
            schedule.getReminderSentAt(),
            null // createdAt - set by @PrePersist
        );
    }

    public ScheduledPayment toDomain() {
        return ScheduledPayment.builder()
            .scheduleId(scheduleId)
            .cardId(cardId)
            .scheduledDate(scheduledDate)
            .scheduledAmount(scheduledAmount)
            .paymentType(paymentType)
            .preference(preference)
            .dueDate(dueDate)
            .reminderSentAt(reminderSentAt)
            .createdAt(createdAt)
            .build();
    }

    void markReminderSent(Instant sentAt) {
        this.reminderSentAt = sentAt;
    }
}
