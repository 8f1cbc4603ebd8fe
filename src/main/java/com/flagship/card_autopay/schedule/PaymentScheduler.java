package com.flagship.card_autopay.schedule;

import com.flagship.card_autopay.automation.AutomationRuleEvaluator;
import com.flagship.card_autopay.automation.MissingDueDateException;
import com.flagship.card_autopay.card.Card;
import com.flagship.card_autopay.card.CardNotFoundException;
import com.flagship.card_autopay.card.CardRegistry;
import com.flagship.card_autopay.card.PaymentPreference;
import com.flagship.card_autopay.common.concurrency.EntityLockRegistry;
import com.flagship.card_autopay.common.exception.InvalidTransitionException;
import com.flagship.card_autopay.notification.LifecycleNotification;
import com.flagship.card_autopay.notification.NotificationDispatcher;
import com.flagship.card_autopay.observability.AutopayMetrics;
import com.flagship.card_autopay.payment.InvalidAmountException;
import com.flagship.card_autopay.payment.Payment;
import com.flagship.card_autopay.payment.PaymentLifecycleService;
import com.flagship.card_autopay.payment.PaymentStatus;
import com.flagship.card_autopay.payment.PaymentStore;
import com.flagship.card_autopay.payment.PaymentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns future payment intents: creates them, fires them when due, and cancels them.
 *
 * Firing is idempotent per schedule id. The payment is inserted first (unique on
 * schedule id) and the schedule is deleted second, so a crash between the two steps is
 * repaired by the next fire returning the existing payment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentScheduler {

    static final String SCHEDULE_LOCK_SCOPE = "schedule";
    static final String CARD_SCHEDULE_LOCK_SCOPE = "card-schedule";

    private final ScheduledPaymentStore scheduleStore;
    private final PaymentStore paymentStore;
    private final CardRegistry cardRegistry;
    private final AutomationRuleEvaluator ruleEvaluator;
    private final PaymentLifecycleService lifecycle;
    private final EntityLockRegistry locks;
    private final NotificationDispatcher notifications;
    private final AutopayMetrics metrics;
    private final Clock clock;

    /**
     * Schedules the card's next automatic payment, replacing any automatic schedule it already has.
     * The payment fires {@code bufferHours} before the card's due date.
     *
     * @return the new automatic schedule
     * @throws CardNotFoundException if the card does not exist
     * @throws com.flagship.card_autopay.automation.AutomationDisabledException if automation is off
     * @throws MissingDueDateException if the card has no due date yet
     * @throws InvalidAmountException if the preference resolves to nothing due
     */
    public ScheduledPayment scheduleAutomatic(UUID cardId) {
        Card card = cardRegistry.getCard(cardId);
        ScheduledPayment next = ruleEvaluator.computeNextPayment(card);
        return locks.withLock(CARD_SCHEDULE_LOCK_SCOPE, cardId, () -> replaceAutomatic(card.getId(), next));
    }

    /**
     * Schedules a manual payment for a chosen time and amount. Manual schedules survive
     * automation changes and syncs.
     *
     * @return the new manual schedule
     * @throws CardNotFoundException if the card does not exist
     * @throws InvalidAmountException if the amount is missing or not positive
     * @throws IllegalArgumentException if the date is missing
     */
    public ScheduledPayment scheduleManual(UUID cardId, Instant scheduledDate, BigDecimal amount) {
        Card card = cardRegistry.getCard(cardId);
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("Scheduled amount must be greater than zero, got " + amount);
        }
        if (scheduledDate == null) {
            throw new IllegalArgumentException("Scheduled date is required");
        }
        ScheduledPayment schedule = ScheduledPayment.builder()
            .scheduleId(UUID.randomUUID())
            .cardId(card.getId())
            .scheduledDate(scheduledDate)
            .scheduledAmount(amount)
            .paymentType(PaymentType.MANUAL)
            .preference(PaymentPreference.CUSTOM_AMOUNT)
            .dueDate(card.getPaymentDueDate())
            .build();
        ScheduledPayment saved = scheduleStore.insert(schedule);
        metrics.recordScheduleCreated(PaymentType.MANUAL.name());
        log.info("Scheduled manual payment {} for card {} at {}: amount={}",
            saved.getScheduleId(), cardId, scheduledDate, amount);
        return saved;
    }

    /**
     * Brings the card's automatic schedule in line with its current data.
     *
     * Removes it when automation is off, when nothing can be computed (no due date, nothing due),
     * or when the card's current due date is already covered. An automatic payment covers its due
     * date whatever became of it, so a declined or cancelled one is never re-created here; a manual
     * payment covers it only while it is not FAILED or CANCELLED. Otherwise keeps an identical
     * schedule or replaces a stale one.
     *
     * @return the card's automatic schedule after the refresh, or empty if it has none
     */
    public Optional<ScheduledPayment> refreshAutomaticSchedule(Card card) {
        return locks.withLock(CARD_SCHEDULE_LOCK_SCOPE, card.getId(), () -> {
            if (!card.isAutomationEnabled()) {
                removeAutomatic(card.getId());
                return Optional.empty();
            }
            if (isDueDateCovered(card.getId(), card.getPaymentDueDate())) {
                log.info("Card {} already has a payment for due date {}, no automatic schedule needed",
                    card.getId(), card.getPaymentDueDate());
                removeAutomatic(card.getId());
                return Optional.empty();
            }

            ScheduledPayment next;
            try {
                next = ruleEvaluator.computeNextPayment(card);
            } catch (MissingDueDateException | InvalidAmountException e) {
                log.info("No automatic payment for card {}: {}", card.getId(), e.getMessage());
                removeAutomatic(card.getId());
                return Optional.empty();
            }

            Optional<ScheduledPayment> current = automaticSchedules(card.getId()).stream()
                .filter(s -> s.getScheduledDate().equals(next.getScheduledDate())
                    && s.getScheduledAmount().compareTo(next.getScheduledAmount()) == 0)
                .findFirst();
            if (current.isPresent()) {
                return current;
            }
            return Optional.of(replaceAutomatic(card.getId(), next));
        });
    }

    /**
     * Deletes the card's unfired automatic schedules. Manual schedules are kept.
     */
    public void removeAutomaticSchedules(UUID cardId) {
        locks.withLock(CARD_SCHEDULE_LOCK_SCOPE, cardId, () -> removeAutomatic(cardId));
    }

    /**
     * Turns a due schedule into a PENDING payment.
     * Runs under the card's schedule lock, so it never interleaves with a refresh of the same card.
     *
     * @return the new payment, or the payment created by an earlier fire of the same schedule
     * @throws ScheduleNotDueException if {@code now} is before the scheduled date
     * @throws ScheduleNotFoundException if the schedule never existed
     */
    public Payment fire(UUID scheduleId, Instant now) {
        UUID cardId = scheduleStore.findById(scheduleId).map(ScheduledPayment::getCardId)
            .or(() -> paymentStore.findByScheduleId(scheduleId).map(Payment::getCardId))
            .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
        // card-schedule before schedule, the only order in which the two are nested
        return locks.withLock(CARD_SCHEDULE_LOCK_SCOPE, cardId,
            () -> locks.withLock(SCHEDULE_LOCK_SCOPE, scheduleId, () -> fireLocked(scheduleId, now)));
    }

    private Payment fireLocked(UUID scheduleId, Instant now) {
        Optional<Payment> alreadyFired = paymentStore.findByScheduleId(scheduleId);
        if (alreadyFired.isPresent()) {
            scheduleStore.delete(scheduleId);
            log.info("Schedule {} already fired as payment {}", scheduleId, alreadyFired.get().getId());
            return alreadyFired.get();
        }

        ScheduledPayment schedule = scheduleStore.findById(scheduleId)
            .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
        if (!schedule.isDue(now)) {
            throw new ScheduleNotDueException(scheduleId, schedule.getScheduledDate(), now);
        }

        Payment payment = lifecycle.createFromSchedule(schedule);
        scheduleStore.delete(scheduleId);
        metrics.recordScheduleFired("fired");
        log.info("Fired schedule {} as payment {}", scheduleId, payment.getId());
        return payment;
    }

    /**
     * Removes a schedule that has not fired yet.
     *
     * @throws InvalidTransitionException if the schedule already fired; cancel the payment instead
     * @throws ScheduleNotFoundException if the schedule never existed
     */
    public void cancelScheduled(UUID scheduleId) {
        locks.withLock(SCHEDULE_LOCK_SCOPE, scheduleId, () -> {
            if (scheduleStore.delete(scheduleId)) {
                log.info("Cancelled schedule {}", scheduleId);
                return;
            }
            Optional<Payment> fired = paymentStore.findByScheduleId(scheduleId);
            if (fired.isPresent()) {
                throw new InvalidTransitionException(String.format(
                    "Schedule %s already fired as payment %s (%s); cancel the payment instead",
                    scheduleId, fired.get().getId(), fired.get().getStatus()));
            }
            throw new ScheduleNotFoundException(scheduleId);
        });
    }

    /**
     * Fires every schedule due at {@code now} and submits the resulting payments.
     * A failure on one schedule is logged and does not stop the others. Automatic schedules
     * of cards whose automation was turned off are dropped instead of fired.
     *
     * @return counts of fired, submitted, dropped and failed schedules
     */
    public FiringSummary fireDuePayments(Instant now) {
        int fired = 0;
        int submitted = 0;
        int dropped = 0;
        int failed = 0;

        for (ScheduledPayment schedule : scheduleStore.findScheduledUntil(now)) {
            try {
                if (schedule.isAutomatic() && !automationStillEnabled(schedule.getCardId())) {
                    scheduleStore.delete(schedule.getScheduleId());
                    metrics.recordScheduleFired("dropped");
                    log.info("Dropped automatic schedule {}: automation is off for card {}",
                        schedule.getScheduleId(), schedule.getCardId());
                    dropped++;
                    continue;
                }
                Payment payment = fire(schedule.getScheduleId(), now);
                fired++;
                if (payment.getStatus() == PaymentStatus.PENDING
                        && lifecycle.submit(payment.getId()).getStatus() == PaymentStatus.PROCESSING) {
                    submitted++;
                }
            } catch (RuntimeException e) {
                failed++;
                metrics.recordScheduleFired("error");
                log.error("Failed to fire schedule {} for card {}: {}",
                    schedule.getScheduleId(), schedule.getCardId(), e.getMessage(), e);
            }
        }

        FiringSummary summary = new FiringSummary(fired, submitted, dropped, failed);
        if (summary.total() > 0) {
            log.info("Fired due payments: fired={}, submitted={}, dropped={}, failed={}",
                fired, submitted, dropped, failed);
        }
        return summary;
    }

    /**
     * Queues one reminder per schedule that fires within {@code window} of {@code now}.
     *
     * @return number of reminders queued
     */
    public int sendReminders(Instant now, Duration window) {
        int sent = 0;
        for (ScheduledPayment schedule : scheduleStore.findScheduledUntil(now.plus(window))) {
            if (schedule.getReminderSentAt() != null || schedule.isDue(now)) {
                continue;
            }
            try {
                boolean marked = locks.withLock(SCHEDULE_LOCK_SCOPE, schedule.getScheduleId(),
                    () -> scheduleStore.findById(schedule.getScheduleId())
                        .filter(current -> current.getReminderSentAt() == null)
                        .map(current -> scheduleStore.markReminderSent(current.getScheduleId(), now))
                        .orElse(false));
                if (marked) {
                    notifications.dispatch(LifecycleNotification.paymentReminder(schedule.getCardId(),
                        schedule.getScheduleId(), schedule.getScheduledAmount(), schedule.getScheduledDate(), now));
                    metrics.recordReminderSent();
                    sent++;
                }
            } catch (RuntimeException e) {
                log.warn("Could not send reminder for schedule {}: {}", schedule.getScheduleId(), e.getMessage());
            }
        }
        return sent;
    }

    public List<ScheduledPayment> listUpcoming(Instant until) {
        return scheduleStore.findScheduledUntil(until);
    }

    public List<ScheduledPayment> listByCard(UUID cardId) {
        return scheduleStore.findByCardId(cardId);
    }

    public ScheduledPayment getSchedule(UUID scheduleId) {
        return scheduleStore.findById(scheduleId).orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    public Instant now() {
        return clock.instant();
    }

    private ScheduledPayment replaceAutomatic(UUID cardId, ScheduledPayment next) {
        removeAutomatic(cardId);
        ScheduledPayment saved = scheduleStore.insert(next);
        metrics.recordScheduleCreated(PaymentType.AUTOMATIC.name());
        log.info("Scheduled automatic payment {} for card {} at {}: amount={}, dueDate={}",
            saved.getScheduleId(), cardId, saved.getScheduledDate(), saved.getScheduledAmount(), saved.getDueDate());
        return saved;
    }

    private void removeAutomatic(UUID cardId) {
        for (ScheduledPayment schedule : automaticSchedules(cardId)) {
            scheduleStore.delete(schedule.getScheduleId());
            log.debug("Removed automatic schedule {} for card {}", schedule.getScheduleId(), cardId);
        }
    }

    private List<ScheduledPayment> automaticSchedules(UUID cardId) {
        return scheduleStore.findByCardId(cardId).stream()
            .filter(ScheduledPayment::isAutomatic)
            .toList();
    }

    private boolean isDueDateCovered(UUID cardId, Instant dueDate) {
        if (dueDate == null) {
            return false;
        }
        return paymentStore.findByCardId(cardId).stream()
            .filter(p -> dueDate.equals(p.getDueDate()))
            .anyMatch(p -> p.getPaymentType() == PaymentType.AUTOMATIC
                || (p.getStatus() != PaymentStatus.FAILED && p.getStatus() != PaymentStatus.CANCELLED));
    }

    private boolean automationStillEnabled(UUID cardId) {
        try {
            return cardRegistry.getCard(cardId).isAutomationEnabled();
        } catch (CardNotFoundException e) {
            return false;
        }
    }
}
