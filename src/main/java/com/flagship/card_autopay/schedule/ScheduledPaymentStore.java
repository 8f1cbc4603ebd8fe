package com.flagship.card_autopay.schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for scheduled payments. All lists are ordered by scheduled date.
 */
public interface ScheduledPaymentStore {

    ScheduledPayment insert(ScheduledPayment schedule);

    Optional<ScheduledPayment> findById(UUID scheduleId);

    List<ScheduledPayment> findByCardId(UUID cardId);

    /** Schedules with {@code scheduledDate <= until}. */
    List<ScheduledPayment> findScheduledUntil(Instant until);

    boolean markReminderSent(UUID scheduleId, Instant sentAt);

    /** @return true if a schedule was deleted */
    boolean delete(UUID scheduleId);
}
