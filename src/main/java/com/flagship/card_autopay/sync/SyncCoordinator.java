package com.flagship.card_autopay.sync;

import com.flagship.card_autopay.card.AlreadySyncingException;
import com.flagship.card_autopay.card.Card;
import com.flagship.card_autopay.card.CardNotFoundException;
import com.flagship.card_autopay.card.CardRegistry;
import com.flagship.card_autopay.card.CardSnapshot;
import com.flagship.card_autopay.card.ConnectionStatus;
import com.flagship.card_autopay.common.concurrency.ExternalCallGuard;
import com.flagship.card_autopay.notification.LifecycleNotification;
import com.flagship.card_autopay.notification.NotificationDispatcher;
import com.flagship.card_autopay.observability.AutopayMetrics;
import com.flagship.card_autopay.observability.CorrelationContext;
import com.flagship.card_autopay.schedule.PaymentScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Refreshes cards from the bank, one sync in flight per card.
 *
 * A sync always resolves: the card ends CONNECTED or ERROR even when the bank call throws or
 * times out. If the process dies mid-sync, {@link #recoverStuckSyncs} moves the card to ERROR
 * once it has been SYNCING longer than the configured threshold.
 */
@Service
@Slf4j
public class SyncCoordinator {

    private final CardRegistry cardRegistry;
    private final BankDataProvider bankDataProvider;
    private final ExternalCallGuard externalCalls;
    private final PaymentScheduler scheduler;
    private final NotificationDispatcher notifications;
    private final AutopayMetrics metrics;
    private final Executor syncExecutor;
    private final Clock clock;
    private final Duration stuckThreshold;

    public SyncCoordinator(CardRegistry cardRegistry,
                           BankDataProvider bankDataProvider,
                           ExternalCallGuard externalCalls,
                           PaymentScheduler scheduler,
                           NotificationDispatcher notifications,
                           AutopayMetrics metrics,
                           @Qualifier("syncExecutor") Executor syncExecutor,
                           Clock clock,
                           @Value("${autopay.sync.stuck-threshold:PT5M}") Duration stuckThreshold) {
        this.cardRegistry = cardRegistry;
        this.bankDataProvider = bankDataProvider;
        this.externalCalls = externalCalls;
        this.scheduler = scheduler;
        this.notifications = notifications;
        this.metrics = metrics;
        this.syncExecutor = syncExecutor;
        this.clock = clock;
        this.stuckThreshold = stuckThreshold;
    }

    /**
     * Syncs one card.
     *
     * @throws AlreadySyncingException if a sync for this card is in flight; no bank call is made
     * @throws CardNotFoundException if the card does not exist
     */
    public SyncResult requestSync(UUID cardId) {
        cardRegistry.beginSync(cardId);

        try (CorrelationContext.Scope ignored = CorrelationContext.put(CorrelationContext.CARD_ID_MDC_KEY, cardId)) {
            long startTime = System.currentTimeMillis();
            log.info("Sync started");
            SyncResult result;
            try {
                CardSnapshot snapshot = externalCalls.call(ExternalCallGuard.BANK_SYNC,
                    () -> bankDataProvider.fetchCardSnapshot(cardId));
                Card synced = cardRegistry.completeSync(cardId, snapshot);
                metrics.recordSync("synced");
                log.info("Sync completed: minimumDue={}, totalDue={}, dueDate={}",
                    synced.getMinimumDue(), synced.getTotalDue(), synced.getPaymentDueDate());
                refreshSchedule(synced);
                result = SyncResult.synced(synced);
            } catch (RuntimeException e) {
                result = recordFailure(cardId, e);
            }
            metrics.recordLatency("sync", System.currentTimeMillis() - startTime);
            return result;
        }
    }

    /**
     * Syncs the given cards concurrently. Each outcome is independent; a failing or busy card
     * never affects the others.
     */
    public List<SyncResult> syncAll(Collection<UUID> cardIds) {
        List<CompletableFuture<SyncResult>> futures = cardIds.stream()
            .distinct()
            .map(cardId -> CompletableFuture.supplyAsync(() -> syncQuietly(cardId), syncExecutor))
            .toList();
        return futures.stream()
            .map(CompletableFuture::join)
            .toList();
    }

    public List<SyncResult> syncAllCards() {
        return syncAll(cardRegistry.listCards().stream().map(Card::getId).toList());
    }

    /**
     * Background refresh: syncs every automation-enabled card that has no sync in flight, so
     * automatic schedules follow the bank's latest due date and amounts.
     *
     * @return one result per card attempted
     */
    public List<SyncResult> syncAutomatedCards() {
        List<UUID> cardIds = cardRegistry.listCards().stream()
            .filter(Card::isAutomationEnabled)
            .filter(card -> card.getConnectionStatus() != ConnectionStatus.SYNCING)
            .map(Card::getId)
            .toList();
        if (cardIds.isEmpty()) {
            return List.of();
        }
        List<SyncResult> results = syncAll(cardIds);
        long failed = results.stream().filter(result -> !result.isSuccess()).count();
        log.info("Periodic sync of automated cards: attempted={}, failed={}", results.size(), failed);
        return results;
    }

    /**
     * Moves cards stuck in SYNCING past the threshold to ERROR.
     *
     * @return number of cards recovered
     */
    public int recoverStuckSyncs() {
        Instant cutoff = clock.instant().minus(stuckThreshold);
        int recovered = 0;
        for (Card card : cardRegistry.findStuckSyncs(cutoff)) {
            try {
                cardRegistry.failSync(card.getId(), "Sync did not complete within " + stuckThreshold);
                metrics.recordStuckSyncRecovered();
                log.warn("Recovered card {} stuck in SYNCING since {}", card.getId(), card.getSyncStartedAt());
                recovered++;
            } catch (RuntimeException e) {
                log.warn("Could not recover stuck sync for card {}: {}", card.getId(), e.getMessage());
            }
        }
        return recovered;
    }

    private SyncResult syncQuietly(UUID cardId) {
        try {
            return requestSync(cardId);
        } catch (AlreadySyncingException e) {
            metrics.recordSync("already_syncing");
            return SyncResult.alreadySyncing(cardId, e.getMessage());
        } catch (CardNotFoundException e) {
            return SyncResult.notFound(cardId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Sync for card {} could not start: {}", cardId, e.getMessage(), e);
            return SyncResult.failed(cardId, null, e.getMessage());
        }
    }

    private SyncResult recordFailure(UUID cardId, RuntimeException cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        Card failed = cardRegistry.failSync(cardId, reason);
        metrics.recordSync("failed");
        log.warn("Sync failed, card moved to ERROR: {}", reason);
        notifications.dispatch(LifecycleNotification.syncError(cardId, reason, clock.instant()));
        return SyncResult.failed(cardId, failed, reason);
    }

    private void refreshSchedule(Card card) {
        if (!card.isAutomationEnabled()) {
            return;
        }
        try {
            scheduler.refreshAutomaticSchedule(card);
        } catch (RuntimeException e) {
            log.warn("Could not refresh automatic schedule after sync: {}", e.getMessage());
        }
    }
}
