package com.flagship.card_autopay.payment;

import com.flagship.card_autopay.common.exception.StaleWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA-backed {@link PaymentStore}. Each method is its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService implements PaymentStore {

    private final PaymentRepository paymentRepository;

    @Override
    @Transactional
    public Payment insert(Payment payment) {
        PaymentEntity saved = paymentRepository.saveAndFlush(PaymentEntity.fromDomain(payment));
        log.debug("Inserted payment {} for card {}", saved.getId(), saved.getCardId());
        return saved.toDomain();
    }

    @Override
    @Transactional
    public Payment update(Payment payment) {
        PaymentEntity existing = paymentRepository.findById(payment.getId())
            .orElseThrow(() -> new PaymentNotFoundException(payment.getId()));

        if (!Objects.equals(existing.getVersion(), payment.getVersion())) {
            throw new StaleWriteException("Payment", payment.getId(), payment.getVersion(), existing.getVersion());
        }

        existing.updateFromDomain(payment);
        PaymentEntity updated = paymentRepository.saveAndFlush(existing);
        log.debug("Updated payment {} to {} (version {})", updated.getId(), updated.getStatus(), updated.getVersion());
        return updated.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID paymentId) {
        return paymentRepository.findById(paymentId).map(PaymentEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Payment> findByGatewayOrderId(String gatewayOrderId) {
        return paymentRepository.findByGatewayOrderId(gatewayOrderId).map(PaymentEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Payment> findByTransactionId(String transactionId) {
        return paymentRepository.findByTransactionId(transactionId).map(PaymentEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Payment> findByScheduleId(UUID scheduleId) {
        return paymentRepository.findByScheduleId(scheduleId).map(PaymentEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Payment> findByIdempotencyKey(String idempotencyKey) {
        return paymentRepository.findByIdempotencyKey(idempotencyKey).map(PaymentEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Payment> findByCardId(UUID cardId) {
        return paymentRepository.findByCardIdOrderByCreatedAtDesc(cardId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Payment> findByStatusIn(Collection<PaymentStatus> statuses) {
        return paymentRepository.findByStatusInOrderByCreatedAtDesc(statuses).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }
}
