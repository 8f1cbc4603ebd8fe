package com.flagship.card_autopay.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByGatewayOrderId(String gatewayOrderId);

    Optional<PaymentEntity> findByTransactionId(String transactionId);

    Optional<PaymentEntity> findByScheduleId(UUID scheduleId);

    Optional<PaymentEntity> findByIdempotencyKey(String idempotencyKey);

    List<PaymentEntity> findByCardIdOrderByCreatedAtDesc(UUID cardId);

    List<PaymentEntity> findByStatusInOrderByCreatedAtDesc(Collection<PaymentStatus> statuses);
}
