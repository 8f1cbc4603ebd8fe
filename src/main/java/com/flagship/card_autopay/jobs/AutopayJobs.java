package com.flagship.card_autopay.jobs;

import com.flagship.card_autopay.schedule.PaymentScheduler;
import com.flagship.card_autopay.sync.SyncCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Periodic work: refreshing automated cards from the bank, firing due schedules, sending
 * reminders and recovering stuck syncs.
 *
 * Each job catches its own failures so one bad run never stops the next.
 */
@Component
@ConditionalOnProperty(name = "autopay.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AutopayJobs {

    private final PaymentScheduler scheduler;
    private final SyncCoordinator syncCoordinator;

    @Value("${autopay.scheduler.reminder-window:PT24H}")
    private Duration reminderWindow;

    @Scheduled(fixedDelayString = "${autopay.sync.interval-ms:3600000}",
            initialDelayString = "${autopay.sync.initial-delay-ms:30000}")
    public void syncAutomatedCards() {
        try {
            syncCoordinator.syncAutomatedCards();
        } catch (Exception e) {
            log.error("Periodic card sync failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${autopay.scheduler.fire-interval-ms:60000}")
    public void fireDuePayments() {
        try {
            scheduler.fireDuePayments(scheduler.now());
        } catch (Exception e) {
            log.error("Firing due payments failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${autopay.scheduler.reminder-interval-ms:900000}")
    public void sendReminders() {
        try {
            Instant now = scheduler.now();
            int sent = scheduler.sendReminders(now, reminderWindow);
            if (sent > 0) {
                log.info("Queued {} payment reminders", sent);
            }
        } catch (Exception e) {
            log.error("Sending payment reminders failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${autopay.scheduler.stuck-sync-interval-ms:60000}")
    public void recoverStuckSyncs() {
        try {
            syncCoordinator.recoverStuckSyncs();
        } catch (Exception e) {
            log.error("Stuck sync recovery failed", e);
        }
    }
}
