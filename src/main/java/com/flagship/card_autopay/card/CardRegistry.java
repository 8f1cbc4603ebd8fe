package com.flagship.card_autopay.card;

import com.flagship.card_autopay.common.concurrency.EntityLockRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Owner of {@link Card} state.
 *
 * Every mutation runs under the card's entity lock and is written back with a version check,
 * so a card has exactly one writer at a time within this process and stale writers elsewhere
 * are rejected by the store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CardRegistry {

    static final String LOCK_SCOPE = "card";

    private final CardStore cardStore;
    private final EntityLockRegistry locks;
    private final Clock clock;

    public Card addCard(String issuingBank, String networkBrand, String last4, BigDecimal creditLimit,
                        BigDecimal interestRate, BigDecimal lateFeeAmount) {
        Card card = Card.register(UUID.randomUUID(), issuingBank, networkBrand, last4,
            creditLimit, interestRate, lateFeeAmount);
        Card saved = cardStore.insert(card);
        log.info("Registered card {} ({} {} ending {})", saved.getId(), issuingBank, networkBrand, last4);
        return saved;
    }

    public Card getCard(UUID cardId) {
        return cardStore.findById(cardId).orElseThrow(() -> new CardNotFoundException(cardId));
    }

    public List<Card> listCards() {
        return cardStore.findAll();
    }

    public Card enableAutomation(UUID cardId, PaymentPreference preference, BigDecimal customAmount,
                                 int bufferHours) {
        Card updated = mutate(cardId, card -> card.enableAutomation(preference, customAmount, bufferHours));
        log.info("Automation enabled for card {}: preference={}, bufferHours={}", cardId, preference, bufferHours);
        return updated;
    }

    public Card disableAutomation(UUID cardId) {
        Card updated = mutate(cardId, Card::disableAutomation);
        log.info("Automation disabled for card {}", cardId);
        return updated;
    }

    /**
     * Moves the card to {@code SYNCING}. The check and the write happen under the card lock,
     * so two concurrent callers can never both start a sync.
     *
     * @throws AlreadySyncingException if a sync is in flight
     */
    public Card beginSync(UUID cardId) {
        Instant now = clock.instant();
        return mutate(cardId, card -> card.beginSync(now));
    }

    public Card completeSync(UUID cardId, CardSnapshot snapshot) {
        Instant now = clock.instant();
        return mutate(cardId, card -> card.completeSync(snapshot, now));
    }

    public Card failSync(UUID cardId, String reason) {
        return mutate(cardId, card -> card.failSync(reason));
    }

    /**
     * Applies webhook-carried balance facts when they are newer than the card's last sync.
     *
     * @return true if the card changed
     */
    public boolean foldInSnapshot(UUID cardId, CardSnapshot snapshot) {
        return locks.withLock(LOCK_SCOPE, cardId, () -> {
            Card card = getCard(cardId);
            Card updated = card.applySnapshot(snapshot);
            if (updated == card) {
                log.debug("Dropped stale metadata for card {}: asOf={}, lastSync={}",
                    cardId, snapshot.getAsOf(), card.getLastSync());
                return false;
            }
            cardStore.update(updated);
            log.info("Folded webhook metadata into card {}: minimumDue={}, totalDue={}, dueDate={}",
                cardId, updated.getMinimumDue(), updated.getTotalDue(), updated.getPaymentDueDate());
            return true;
        });
    }

    /**
     * Cards whose sync started before {@code cutoff} and never resolved.
     */
    public List<Card> findStuckSyncs(Instant cutoff) {
        return cardStore.findByConnectionStatus(ConnectionStatus.SYNCING).stream()
            .filter(card -> card.getSyncStartedAt() == null || card.getSyncStartedAt().isBefore(cutoff))
            .toList();
    }

    private Card mutate(UUID cardId, UnaryOperator<Card> transition) {
        return locks.withLock(LOCK_SCOPE, cardId, () -> {
            Card card = getCard(cardId);
            return cardStore.update(transition.apply(card));
        });
    }
}
