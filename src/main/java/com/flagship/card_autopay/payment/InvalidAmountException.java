package com.flagship.card_autopay.payment;

import com.flagship.card_autopay.common.exception.BusinessRuleException;

public class InvalidAmountException extends BusinessRuleException {

    public InvalidAmountException(String message) {
        super("INVALID_AMOUNT", message);
    }
}
