package com.flagship.card_autopay.card;

import com.flagship.card_autopay.common.exception.StateConflictException;

import java.util.UUID;

/**
 * A sync was requested while another sync for the same card is still in flight.
 */
public class AlreadySyncingException extends StateConflictException {

    public AlreadySyncingException(UUID cardId) {
        super("ALREADY_SYNCING", "Card " + cardId + " is already syncing");
    }
}
