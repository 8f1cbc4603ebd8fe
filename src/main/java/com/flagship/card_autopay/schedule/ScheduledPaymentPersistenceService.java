package com.flagship.card_autopay.schedule;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA-backed {@link ScheduledPaymentStore}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduledPaymentPersistenceService implements ScheduledPaymentStore {

    private final ScheduledPaymentRepository repository;

    @Override
    @Transactional
    public ScheduledPayment insert(ScheduledPayment schedule) {
        ScheduledPaymentEntity saved = repository.saveAndFlush(ScheduledPaymentEntity.fromDomain(schedule));
        log.debug("Inserted schedule {} for card {} at {}", saved.getScheduleId(), saved.getCardId(),
            saved.getScheduledDate());
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScheduledPayment> findById(UUID scheduleId) {
        return repository.findById(scheduleId).map(ScheduledPaymentEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledPayment> findByCardId(UUID cardId) {
        return repository.findByCardIdOrderByScheduledDateAsc(cardId).stream()
            .map(ScheduledPaymentEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledPayment> findScheduledUntil(Instant until) {
        return repository.findByScheduledDateLessThanEqualOrderByScheduledDateAsc(until).stream()
            .map(ScheduledPaymentEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional
    public boolean markReminderSent(UUID scheduleId, Instant sentAt) {
        return repository.findById(scheduleId)
            .map(entity -> {
                entity.markReminderSent(sentAt);
                repository.save(entity);
                return true;
            })
            .orElse(false);
    }

    @Override
    @Transactional
    public boolean delete(UUID scheduleId) {
        if (!repository.existsById(scheduleId)) {
            return false;
        }
        repository.deleteById(scheduleId);
        log.debug("Deleted schedule {}", scheduleId);
        return true;
    }
}
