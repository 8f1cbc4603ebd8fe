package com.flagship.card_autopay.common.exception;

/**
 * The request is well formed but conflicts with the current state of an entity.
 */
public abstract class StateConflictException extends AutopayException {

    protected StateConflictException(String errorCode, String message) {
        super(errorCode, message);
    }

    protected StateConflictException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
