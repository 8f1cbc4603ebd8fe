package com.flagship.card_autopay.payment;

import com.flagship.card_autopay.card.PaymentPreference;
import com.flagship.card_autopay.common.exception.InvalidTransitionException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A card payment from creation to settlement.
 *
 * Immutable; each transition method checks {@link PaymentStatus#canTransitionTo} and
 * returns a new instance. Once terminal, a payment never changes again.
 */
@Value
@Builder(toBuilder = true)
public class Payment {
    UUID id;
    UUID cardId;
    PaymentStatus status;
    BigDecimal amount;
    PaymentPreference preference;
    PaymentType paymentType;
    /** Schedule this payment was fired from; null for immediate payments. */
    UUID scheduleId;
    /** Client-supplied key for immediate payments; null otherwise. */
    String idempotencyKey;
    String gatewayOrderId;
    String transactionId;
    /** Card due date this payment is meant to cover. */
    Instant dueDate;
    String failureReason;
    /** Last transient error (gateway unreachable, timeout). Cleared on successful submit. */
    String lastError;
    BigDecimal interestSaved;
    BigDecimal lateFeePrevented;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;
    Long version;

    /**
     * Creates a new payment in PENDING status, ready to submit.
     *
     * @param scheduleId schedule the payment was fired from, or null for an immediate payment
     * @param dueDate card due date the payment covers
     * @return New Payment instance with PENDING status
     */
    public static Payment pending(UUID cardId, BigDecimal amount, PaymentPreference preference,
                                  PaymentType paymentType, UUID scheduleId, Instant dueDate,
                                  String idempotencyKey) {
        return Payment.builder()
            .id(UUID.randomUUID())
            .cardId(cardId)
            .status(PaymentStatus.PENDING)
            .amount(amount)
            .preference(preference)
            .paymentType(paymentType)
            .scheduleId(scheduleId)
            .idempotencyKey(idempotencyKey)
            .dueDate(dueDate)
            .interestSaved(BigDecimal.ZERO)
            .lateFeePrevented(BigDecimal.ZERO)
            .build();
    }

    /**
     * Transitions payment to PROCESSING status once the gateway accepted the order.
     * Only valid from PENDING status. Clears any earlier submission error.
     *
     * @param gatewayOrderId order id returned by the gateway
     * @return New Payment instance with PROCESSING status
     * @throws InvalidTransitionException if transition is not allowed
     */
    public Payment markProcessing(String gatewayOrderId) {
        requireTransition(PaymentStatus.PROCESSING);
        return toBuilder()
            .status(PaymentStatus.PROCESSING)
            .gatewayOrderId(gatewayOrderId)
            .lastError(null)
            .build();
    }

    /**
     * Records a transient submission failure. The payment stays PENDING and can be resubmitted.
     * Only valid from PENDING status.
     *
     * @param error description of the failed gateway call
     * @return New Payment instance carrying the error
     * @throws InvalidTransitionException if the payment is not PENDING
     */
    public Payment recordSubmissionFailure(String error) {
        if (status != PaymentStatus.PENDING) {
            throw InvalidTransitionException.of("payment", id, status, PaymentStatus.PENDING);
        }
        return toBuilder().lastError(error).build();
    }

    /**
     * Transitions payment to COMPLETED status on gateway capture.
     * Valid from PROCESSING, and from PENDING when the capture arrives before the submit response.
     *
     * @param transactionId gateway transaction id; the existing one is kept when null
     * @return New Payment instance with COMPLETED status and its savings
     * @throws InvalidTransitionException if transition is not allowed
     */
    public Payment complete(String transactionId, BigDecimal interestSaved, BigDecimal lateFeePrevented,
                            Instant settledAt) {
        requireTransition(PaymentStatus.COMPLETED);
        return toBuilder()
            .status(PaymentStatus.COMPLETED)
            .transactionId(transactionId != null ? transactionId : this.transactionId)
            .interestSaved(interestSaved)
            .lateFeePrevented(lateFeePrevented)
            .lastError(null)
            .completedAt(settledAt)
            .build();
    }

    /**
     * Transitions payment to FAILED status on a gateway decline.
     * Only valid from PROCESSING status. Savings are reset to zero.
     *
     * @return New Payment instance with FAILED status
     * @throws InvalidTransitionException if transition is not allowed
     */
    public Payment fail(String transactionId, String reason, Instant failedAt) {
        requireTransition(PaymentStatus.FAILED);
        return toBuilder()
            .status(PaymentStatus.FAILED)
            .transactionId(transactionId != null ? transactionId : this.transactionId)
            .failureReason(reason != null ? reason : "Payment failed at gateway")
            .interestSaved(BigDecimal.ZERO)
            .lateFeePrevented(BigDecimal.ZERO)
            .completedAt(failedAt)
            .build();
    }

    /**
     * Transitions payment to CANCELLED status.
     * Only valid from SCHEDULED or PENDING status.
     *
     * @return New Payment instance with CANCELLED status
     * @throws InvalidTransitionException if transition is not allowed
     */
    public Payment cancel(Instant cancelledAt) {
        requireTransition(PaymentStatus.CANCELLED);
        return toBuilder()
            .status(PaymentStatus.CANCELLED)
            .completedAt(cancelledAt)
            .build();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void requireTransition(PaymentStatus target) {
        if (!status.canTransitionTo(target)) {
            throw InvalidTransitionException.of("payment", id, status, target);
        }
    }
}
