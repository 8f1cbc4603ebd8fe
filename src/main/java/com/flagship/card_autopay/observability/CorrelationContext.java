package com.flagship.card_autopay.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus MDC helpers for the ids that appear on every lifecycle log line.
 *
 * Use {@link #put} in a try-with-resources block so the MDC key is restored when the
 * operation ends:
 * <pre>
 * try (CorrelationContext.Scope ignored = CorrelationContext.put(CorrelationContext.PAYMENT_ID_MDC_KEY, id)) {
 *     ...
 * }
 * </pre>
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PAYMENT_ID_MDC_KEY = "paymentId";
    public static final String CARD_ID_MDC_KEY = "cardId";
    public static final String EVENT_ID_MDC_KEY = "eventId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form, easier to grep in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts {@code key} into the MDC and returns a scope that restores the previous value on close.
     */
    public static Scope put(String key, Object value) {
        String previous = MDC.get(key);
        if (value != null) {
            MDC.put(key, value.toString());
        }
        return () -> {
            if (previous != null) {
                MDC.put(key, previous);
            } else {
                MDC.remove(key);
            }
        };
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
