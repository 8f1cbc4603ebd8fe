package com.flagship.card_autopay.common.exception;

/**
 * Base type for every domain failure raised by the autopay engine.
 *
 * The error code is stable and is what API clients match on; the message is for humans.
 */
public abstract class AutopayException extends RuntimeException {

    private final String errorCode;

    protected AutopayException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AutopayException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
