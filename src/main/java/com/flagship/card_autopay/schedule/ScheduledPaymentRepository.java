package com.flagship.card_autopay.schedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ScheduledPaymentRepository extends JpaRepository<ScheduledPaymentEntity, UUID> {

    List<ScheduledPaymentEntity> findByCardIdOrderByScheduledDateAsc(UUID cardId);

    List<ScheduledPaymentEntity> findByScheduledDateLessThanEqualOrderByScheduledDateAsc(Instant until);
}
