package com.flagship.card_autopay.schedule;

import com.flagship.card_autopay.card.Card;
import com.flagship.card_autopay.card.PaymentPreference;
import com.flagship.card_autopay.common.exception.InvalidTransitionException;
import com.flagship.card_autopay.notification.NotificationType;
import com.flagship.card_autopay.payment.GatewaySettlement;
import com.flagship.card_autopay.payment.InvalidAmountException;
import com.flagship.card_autopay.payment.Payment;
import com.flagship.card_autopay.payment.PaymentStatus;
import com.flagship.card_autopay.payment.PaymentType;
import com.flagship.card_autopay.support.AutopayTestHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.flagship.card_autopay.support.AutopayTestHarness.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class PaymentSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-06-08T10:00:00Z");
    private static final Instant DUE = Instant.parse("2024-06-10T00:00:00Z");
    private static final Instant FIRE_AT = Instant.parse("2024-06-09T00:00:00Z");

    private AutopayTestHarness harness;
    private PaymentScheduler scheduler;

    @BeforeEach
    void setUp() {
        harness = new AutopayTestHarness(NOW);
        scheduler = harness.scheduler;
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private Card automatedCard() {
        return harness.automatedCard(new BigDecimal("500.00"), new BigDecimal("1000.00"), DUE,
            PaymentPreference.MINIMUM_DUE, 24);
    }

    private void resync(UUID cardId, Instant dueDate) {
        harness.clock.advance(Duration.ofHours(1));
        harness.bank.willReturn(cardId,
            snapshot(new BigDecimal("500.00"), new BigDecimal("1000.00"), dueDate, harness.clock.instant()));
        assertTrue(harness.syncCoordinator.requestSync(cardId).isSuccess());
    }

    private ScheduledPayment onlySchedule(UUID cardId) {
        List<ScheduledPayment> schedules = scheduler.listByCard(cardId);
        assertEquals(1, schedules.size());
        return schedules.get(0);
    }

    @Test
    @DisplayName("Enabling automation schedules the next payment at due date minus buffer")
    void testEnableAutomationSchedules() {
        Card card = automatedCard();

        ScheduledPayment schedule = onlySchedule(card.getId());
        assertEquals(FIRE_AT, schedule.getScheduledDate());
        assertEquals(0, new BigDecimal("500.00").compareTo(schedule.getScheduledAmount()));
        assertEquals(PaymentType.AUTOMATIC, schedule.getPaymentType());
    }

    @Test
    @DisplayName("Scheduling automatically twice keeps a single automatic schedule")
    void testScheduleAutomaticReplaces() {
        Card card = automatedCard();

        ScheduledPayment replaced = scheduler.scheduleAutomatic(card.getId());

        assertEquals(replaced.getScheduleId(), onlySchedule(card.getId()).getScheduleId());
    }

    @Test
    @DisplayName("Firing before the scheduled date is rejected")
    void testFireEarlyRejected() {
        Card card = automatedCard();
        ScheduledPayment schedule = onlySchedule(card.getId());

        assertThrows(ScheduleNotDueException.class,
            () -> scheduler.fire(schedule.getScheduleId(), FIRE_AT.minusSeconds(1)));
        assertTrue(scheduler.listByCard(card.getId()).contains(schedule));
    }

    @Test
    @DisplayName("Firing is idempotent per schedule id")
    void testFireIdempotent() {
        Card card = automatedCard();
        ScheduledPayment schedule = onlySchedule(card.getId());

        Payment first = scheduler.fire(schedule.getScheduleId(), FIRE_AT);
        Payment second = scheduler.fire(schedule.getScheduleId(), FIRE_AT.plusSeconds(60));

        assertEquals(PaymentStatus.PENDING, first.getStatus());
        assertEquals(schedule.getScheduleId(), first.getScheduleId());
        assertEquals(first.getId(), second.getId());
        assertEquals(1, harness.paymentStore.size());
        assertTrue(scheduler.listByCard(card.getId()).isEmpty());
    }

    @Test
    @DisplayName("Cancelling a fired schedule fails; cancelling its pending payment succeeds")
    void testCancelAfterFire() {
        Card card = automatedCard();
        ScheduledPayment schedule = onlySchedule(card.getId());
        Payment payment = scheduler.fire(schedule.getScheduleId(), FIRE_AT);

        assertThrows(InvalidTransitionException.class, () -> scheduler.cancelScheduled(schedule.getScheduleId()));

        Payment cancelled = harness.lifecycle.cancel(payment.getId());
        assertEquals(PaymentStatus.CANCELLED, cancelled.getStatus());
    }

    @Test
    @DisplayName("Cancelling an unfired schedule removes it; unknown ids are not found")
    void testCancelScheduled() {
        Card card = automatedCard();
        ScheduledPayment schedule = onlySchedule(card.getId());

        scheduler.cancelScheduled(schedule.getScheduleId());

        assertTrue(scheduler.listByCard(card.getId()).isEmpty());
        assertThrows(ScheduleNotFoundException.class, () -> scheduler.cancelScheduled(schedule.getScheduleId()));
        assertThrows(ScheduleNotFoundException.class, () -> scheduler.fire(UUID.randomUUID(), FIRE_AT));
    }

    @Test
    @DisplayName("Manual schedules need a positive amount and a date")
    void testScheduleManual() {
        Card card = harness.connectedCard(new BigDecimal("500.00"), new BigDecimal("1000.00"), DUE);

        ScheduledPayment manual = scheduler.scheduleManual(card.getId(), NOW.plusSeconds(3600), new BigDecimal("250.00"));
        assertEquals(PaymentType.MANUAL, manual.getPaymentType());
        assertEquals(PaymentPreference.CUSTOM_AMOUNT, manual.getPreference());

        assertThrows(InvalidAmountException.class, () -> scheduler.scheduleManual(card.getId(), NOW, BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleManual(card.getId(), null, BigDecimal.ONE));
    }

    @Test
    @DisplayName("Batch firing submits due payments and drops automatic schedules of disabled cards")
    void testFireDuePayments() {
        Card automated = automatedCard();
        Card manual = harness.connectedCard(new BigDecimal("100.00"), new BigDecimal("200.00"), DUE);
        scheduler.scheduleManual(manual.getId(), FIRE_AT.minusSeconds(60), new BigDecimal("150.00"));
        scheduler.scheduleManual(manual.getId(), DUE.plusSeconds(86_400), new BigDecimal("50.00"));
        Card disabled = automatedCard();
        harness.cardRegistry.disableAutomation(disabled.getId());

        FiringSummary summary = scheduler.fireDuePayments(FIRE_AT);

        assertEquals(2, summary.getFired());
        assertEquals(2, summary.getSubmitted());
        assertEquals(1, summary.getDropped());
        assertEquals(0, summary.getFailed());
        assertEquals(PaymentStatus.PROCESSING, harness.lifecycle.listByCard(automated.getId()).get(0).getStatus());
        assertEquals(1, scheduler.listByCard(manual.getId()).size());
        assertTrue(scheduler.listByCard(disabled.getId()).isEmpty());
    }

    @Test
    @DisplayName("Reminders go out once per schedule inside the window")
    void testSendReminders() {
        Card card = automatedCard();

        assertEquals(0, scheduler.sendReminders(NOW, Duration.ofHours(1)));
        assertEquals(1, scheduler.sendReminders(NOW, Duration.ofHours(24)));
        assertEquals(0, scheduler.sendReminders(NOW.plusSeconds(60), Duration.ofHours(24)));

        assertEquals(1, harness.notifications.ofType(NotificationType.PAYMENT_REMINDER).size());
        assertNotNull(onlySchedule(card.getId()).getReminderSentAt());
    }

    @Test
    @DisplayName("No automatic schedule while a live payment already covers the due date")
    void testRefreshSkipsCoveredDueDate() {
        Card card = automatedCard();
        harness.lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);

        Optional<ScheduledPayment> refreshed = scheduler.refreshAutomaticSchedule(harness.cardRegistry.getCard(card.getId()));

        assertTrue(refreshed.isEmpty());
        assertTrue(scheduler.listByCard(card.getId()).isEmpty());
    }

    @Test
    @DisplayName("Disabling automation removes the automatic schedule but keeps manual ones")
    void testDisableAutomationRemovesSchedule() {
        Card card = automatedCard();
        scheduler.scheduleManual(card.getId(), DUE.minusSeconds(7200), new BigDecimal("50.00"));

        harness.automation.disable(card.getId());

        List<ScheduledPayment> remaining = scheduler.listByCard(card.getId());
        assertEquals(1, remaining.size());
        assertEquals(PaymentType.MANUAL, remaining.get(0).getPaymentType());
    }

    @Test
    @DisplayName("A declined automatic payment is not retried by the next sync for the same due date")
    void testDeclinedAutomaticPaymentNotRescheduled() {
        Card card = automatedCard();
        scheduler.fireDuePayments(FIRE_AT);
        Payment declined = harness.lifecycle.listByCard(card.getId()).get(0);
        assertEquals(PaymentStatus.PROCESSING, declined.getStatus());
        harness.lifecycle.settle(declined.getId(), GatewaySettlement.failed("pay_declined_1", "insufficient funds"));
        harness.clock.set(FIRE_AT.plusSeconds(600));

        resync(card.getId(), DUE);

        assertTrue(scheduler.listByCard(card.getId()).isEmpty());
        assertEquals(0, scheduler.fireDuePayments(harness.clock.instant()).getFired());
        assertEquals(1, harness.lifecycle.listByCard(card.getId()).size());
        assertEquals(1, harness.gateway.callCount());
    }

    @Test
    @DisplayName("A cancelled automatic payment is not re-created by the next sync for the same due date")
    void testCancelledAutomaticPaymentNotRescheduled() {
        Card card = automatedCard();
        Payment fired = scheduler.fire(onlySchedule(card.getId()).getScheduleId(), FIRE_AT);
        harness.lifecycle.cancel(fired.getId());
        harness.clock.set(FIRE_AT.plusSeconds(600));

        resync(card.getId(), DUE);

        assertTrue(scheduler.listByCard(card.getId()).isEmpty());
        assertEquals(0, scheduler.fireDuePayments(harness.clock.instant()).getFired());
        assertEquals(PaymentStatus.CANCELLED, harness.lifecycle.getPayment(fired.getId()).getStatus());
    }

    @Test
    @DisplayName("A new due date after a declined payment gets a new automatic schedule")
    void testNewDueDateAfterDeclineSchedules() {
        Card card = automatedCard();
        scheduler.fireDuePayments(FIRE_AT);
        Payment declined = harness.lifecycle.listByCard(card.getId()).get(0);
        harness.lifecycle.settle(declined.getId(), GatewaySettlement.failed("pay_declined_2", "card blocked"));
        harness.clock.set(FIRE_AT.plusSeconds(600));
        Instant nextDue = DUE.plus(Duration.ofDays(30));

        resync(card.getId(), nextDue);

        ScheduledPayment next = onlySchedule(card.getId());
        assertEquals(nextDue, next.getDueDate());
        assertEquals(nextDue.minus(Duration.ofHours(24)), next.getScheduledDate());
    }

    @Test
    @DisplayName("A failed manual payment leaves the due date open for the automatic schedule")
    void testFailedManualPaymentDoesNotCoverDueDate() {
        Card card = automatedCard();
        Payment manual = harness.lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);
        assertEquals(PaymentType.MANUAL, manual.getPaymentType());
        harness.lifecycle.submit(manual.getId());
        harness.lifecycle.settle(manual.getId(), GatewaySettlement.failed("pay_declined_3", "insufficient funds"));

        Optional<ScheduledPayment> refreshed = scheduler.refreshAutomaticSchedule(harness.cardRegistry.getCard(card.getId()));

        assertTrue(refreshed.isPresent());
        assertEquals(FIRE_AT, refreshed.get().getScheduledDate());
    }

    @Test
    @DisplayName("Firing waits for a schedule refresh of the same card to finish")
    void testFireWaitsForCardScheduleRefresh() throws Exception {
        Card card = automatedCard();
        UUID scheduleId = onlySchedule(card.getId()).getScheduleId();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> holder = CompletableFuture.runAsync(() ->
            harness.locks.withLock(PaymentScheduler.CARD_SCHEDULE_LOCK_SCOPE, card.getId(), () -> {
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
        assertTrue(held.await(5, TimeUnit.SECONDS));

        CompletableFuture<Payment> firing = CompletableFuture.supplyAsync(() -> scheduler.fire(scheduleId, FIRE_AT));
        Thread.sleep(200);
        assertFalse(firing.isDone());
        assertEquals(0, harness.paymentStore.size());

        release.countDown();
        Payment payment = firing.get(5, TimeUnit.SECONDS);
        holder.get(5, TimeUnit.SECONDS);

        assertEquals(scheduleId, payment.getScheduleId());
        assertTrue(scheduler.listByCard(card.getId()).isEmpty());
        assertTrue(scheduler.refreshAutomaticSchedule(harness.cardRegistry.getCard(card.getId())).isEmpty());
        assertEquals(1, harness.paymentStore.size());
    }
}
