package com.flagship.card_autopay.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer instruments for the sync, scheduling, payment and webhook paths.
 *
 * All counters are tagged; tag values pass through {@link #sanitizeTag} so an
 * exception message can never explode cardinality.
 */
@Component
public class AutopayMetrics {

    private final MeterRegistry registry;

    public AutopayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ==================== Sync ====================

    public void recordSync(String outcome) {
        registry.counter("autopay.sync", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordStuckSyncRecovered() {
        registry.counter("autopay.sync.stuck_recovered").increment();
    }

    // ==================== Scheduling ====================

    public void recordScheduleCreated(String paymentType) {
        registry.counter("autopay.schedule.created", "type", sanitizeTag(paymentType)).increment();
    }

    public void recordScheduleFired(String outcome) {
        registry.counter("autopay.schedule.fired", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordReminderSent() {
        registry.counter("autopay.schedule.reminders").increment();
    }

    // ==================== Payments ====================

    public void recordPaymentCreated(String paymentType) {
        registry.counter("autopay.payment.created", "type", sanitizeTag(paymentType)).increment();
    }

    public void recordSubmission(String outcome) {
        registry.counter("autopay.payment.submitted", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordSettlement(String status) {
        registry.counter("autopay.payment.settled", "status", sanitizeTag(status)).increment();
    }

    public void recordPaymentCancelled() {
        registry.counter("autopay.payment.cancelled").increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("autopay.operation.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    // ==================== Webhooks ====================

    public void recordWebhook(String eventType, String outcome) {
        registry.counter("autopay.webhook",
                "event_type", sanitizeTag(eventType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordSeenSetLookup(boolean hit) {
        registry.counter("autopay.webhook.seen_set", "result", hit ? "hit" : "miss").increment();
    }

    // ==================== Notifications ====================

    public void recordNotificationQueued(String type) {
        registry.counter("autopay.notification.queued", "type", sanitizeTag(type)).increment();
    }

    public void recordNotificationDropped(String type) {
        registry.counter("autopay.notification.dropped", "type", sanitizeTag(type)).increment();
    }

    public void recordNotificationPublished(String type) {
        registry.counter("autopay.notification.published", "type", sanitizeTag(type)).increment();
    }

    public void recordNotificationPublishFailed(String type) {
        registry.counter("autopay.notification.publish_failed", "type", sanitizeTag(type)).increment();
    }

    public void registerGauge(String name, Supplier<Number> supplier) {
        registry.gauge(name, Tags.empty(), supplier, s -> s.get().doubleValue());
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
