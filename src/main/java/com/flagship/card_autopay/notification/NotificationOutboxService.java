package com.flagship.card_autopay.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Reads and writes the {@code notification_outbox} table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationOutboxService {

    private final NotificationOutboxRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional
    public void enqueue(LifecycleNotification notification) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize notification " + notification.getId(), e);
        }
        repository.save(NotificationOutboxEntity.queued(notification, payload));
        log.debug("Queued {} notification {} for card {}",
            notification.getType().getWireName(), notification.getId(), notification.getCardId());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<NotificationOutboxEntity> findPublishable(int maxRetries, int limit) {
        return repository.findPublishableForUpdate(maxRetries, limit);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID id) {
        repository.findById(id).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID id, String errorMessage) {
        repository.findById(id).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
        });
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    @Transactional(readOnly = true)
    public long countDeadLettered(int maxRetries) {
        return repository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);
    }
}
