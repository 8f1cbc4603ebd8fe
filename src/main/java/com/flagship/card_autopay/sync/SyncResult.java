package com.flagship.card_autopay.sync;

import com.flagship.card_autopay.card.Card;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of one card sync. Failures are reported here, not thrown.
 */
@Value
public class SyncResult {

    public enum Outcome {
        SYNCED,
        FAILED,
        ALREADY_SYNCING,
        NOT_FOUND
    }

    UUID cardId;
    Outcome outcome;
    /** Card state after the attempt; null when the card was not found. */
    Card card;
    String error;

    public static SyncResult synced(Card card) {
        return new SyncResult(card.getId(), Outcome.SYNCED, card, null);
    }

    public static SyncResult failed(UUID cardId, Card card, String error) {
        return new SyncResult(cardId, Outcome.FAILED, card, error);
    }

    public static SyncResult alreadySyncing(UUID cardId, String error) {
        return new SyncResult(cardId, Outcome.ALREADY_SYNCING, null, error);
    }

    public static SyncResult notFound(UUID cardId, String error) {
        return new SyncResult(cardId, Outcome.NOT_FOUND, null, error);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SYNCED;
    }
}
