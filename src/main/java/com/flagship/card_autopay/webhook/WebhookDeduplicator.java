package com.flagship.card_autopay.webhook;

import com.flagship.card_autopay.observability.AutopayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Remembers which webhook event ids have been handled.
 *
 * Redis holds a short-lived seen-set as a fast path; the {@code processed_webhook_events}
 * table is the source of truth. Redis being unavailable only costs a database lookup.
 */
@Service
@Slf4j
public class WebhookDeduplicator {

    private static final String REDIS_KEY_PREFIX = "webhook:seen:";

    private final ProcessedWebhookRepository repository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final AutopayMetrics metrics;
    private final Duration seenTtl;

    public WebhookDeduplicator(ProcessedWebhookRepository repository,
                               Optional<StringRedisTemplate> redisTemplate,
                               AutopayMetrics metrics,
                               @Value("${autopay.webhook.dedup-ttl:PT24H}") Duration seenTtl) {
        this.repository = repository;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
        this.seenTtl = seenTtl;
    }

    public boolean isAlreadyProcessed(String eventId) {
        if (redisTemplate.isPresent()) {
            try {
                if (Boolean.TRUE.equals(redisTemplate.get().hasKey(REDIS_KEY_PREFIX + eventId))) {
                    metrics.recordSeenSetLookup(true);
                    return true;
                }
                metrics.recordSeenSetLookup(false);
            } catch (Exception e) {
                log.warn("Redis seen-set lookup failed for event {}, falling back to database: {}",
                    eventId, e.getMessage());
            }
        }

        boolean processed = repository.existsById(eventId);
        if (processed) {
            remember(eventId);
        }
        return processed;
    }

    /**
     * Records the event as handled. A concurrent delivery of the same event that recorded first
     * wins; this call then does nothing.
     */
    public void record(ProcessedWebhook processed) {
        try {
            repository.saveAndFlush(ProcessedWebhookEntity.fromDomain(processed));
        } catch (DataIntegrityViolationException e) {
            log.debug("Event {} was recorded concurrently", processed.getEventId());
        }
        remember(processed.getEventId());
    }

    public List<ProcessedWebhook> historyForPayment(UUID paymentId) {
        return repository.findByPaymentIdOrderByProcessedAtAsc(paymentId).stream()
            .map(ProcessedWebhookEntity::toDomain)
            .toList();
    }

    private void remember(String eventId) {
        redisTemplate.ifPresent(redis -> {
            try {
                redis.opsForValue().set(REDIS_KEY_PREFIX + eventId, "1", seenTtl);
            } catch (Exception e) {
                log.debug("Could not cache event {} in Redis: {}", eventId, e.getMessage());
            }
        });
    }
}
