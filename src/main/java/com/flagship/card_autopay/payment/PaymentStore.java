package com.flagship.card_autopay.payment;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for payments.
 *
 * {@link #insert} rejects a second payment for the same schedule id or idempotency key
 * with {@link org.springframework.dao.DataIntegrityViolationException}. {@link #update} is a
 * compare-and-set on the payment version.
 */
public interface PaymentStore {

    Payment insert(Payment payment);

    Payment update(Payment payment);

    Optional<Payment> findById(UUID paymentId);

    Optional<Payment> findByGatewayOrderId(String gatewayOrderId);

    Optional<Payment> findByTransactionId(String transactionId);

    Optional<Payment> findByScheduleId(UUID scheduleId);

    Optional<Payment> findByIdempotencyKey(String idempotencyKey);

    /** Newest first. */
    List<Payment> findByCardId(UUID cardId);

    /** Newest first. */
    List<Payment> findByStatusIn(Collection<PaymentStatus> statuses);
}
