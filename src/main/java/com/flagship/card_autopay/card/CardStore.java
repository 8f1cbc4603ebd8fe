package com.flagship.card_autopay.card;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for cards.
 *
 * {@link #update} is a compare-and-set on {@link Card#getVersion()}: it throws
 * {@link com.flagship.card_autopay.common.exception.StaleWriteException} when the stored
 * version differs, and returns the card with its new version otherwise.
 */
public interface CardStore {

    Card insert(Card card);

    Card update(Card card);

    Optional<Card> findById(UUID cardId);

    List<Card> findAll();

    List<Card> findByConnectionStatus(ConnectionStatus status);
}
