package com.flagship.card_autopay.common.exception;

/**
 * A referenced card, payment or schedule does not exist.
 */
public abstract class ResourceNotFoundException extends AutopayException {

    protected ResourceNotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }
}
