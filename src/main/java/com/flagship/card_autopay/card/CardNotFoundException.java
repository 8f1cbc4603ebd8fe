package com.flagship.card_autopay.card;

import com.flagship.card_autopay.common.exception.ResourceNotFoundException;

import java.util.UUID;

public class CardNotFoundException extends ResourceNotFoundException {

    public CardNotFoundException(UUID cardId) {
        super("CARD_NOT_FOUND", "Card not found: " + cardId);
    }
}
