package com.flagship.card_autopay.card;

import com.flagship.card_autopay.common.exception.BusinessRuleException;

public class InvalidPreferenceException extends BusinessRuleException {

    public InvalidPreferenceException(String message) {
        super("INVALID_PREFERENCE", message);
    }
}
