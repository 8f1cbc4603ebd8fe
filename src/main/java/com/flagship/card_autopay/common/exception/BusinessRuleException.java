package com.flagship.card_autopay.common.exception;

/**
 * The input violates a business rule (bad amount, bad preference, missing data).
 */
public abstract class BusinessRuleException extends AutopayException {

    protected BusinessRuleException(String errorCode, String message) {
        super(errorCode, message);
    }
}
