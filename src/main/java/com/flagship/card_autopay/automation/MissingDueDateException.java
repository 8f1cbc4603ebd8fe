package com.flagship.card_autopay.automation;

import com.flagship.card_autopay.common.exception.BusinessRuleException;

import java.util.UUID;

/**
 * The card has no payment due date yet, usually because it has never synced.
 */
public class MissingDueDateException extends BusinessRuleException {

    public MissingDueDateException(UUID cardId) {
        super("MISSING_DUE_DATE", "Card " + cardId + " has no payment due date; sync it first");
    }
}
