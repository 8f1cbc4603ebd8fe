package com.flagship.card_autopay.sync;

import com.flagship.card_autopay.card.CardSnapshot;

import java.util.UUID;

/**
 * Outbound port to the card-issuing bank.
 *
 * May be slow or fail; callers always wrap it in a time limit.
 */
public interface BankDataProvider {

    CardSnapshot fetchCardSnapshot(UUID cardId);
}
