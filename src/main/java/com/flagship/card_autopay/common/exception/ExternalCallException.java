package com.flagship.card_autopay.common.exception;

/**
 * A call to the bank data provider or the payment gateway failed or timed out.
 *
 * This is a transient failure: callers record it on the entity and leave it retryable.
 */
public class ExternalCallException extends AutopayException {

    private final boolean timeout;

    public ExternalCallException(String message, Throwable cause, boolean timeout) {
        super(timeout ? "EXTERNAL_TIMEOUT" : "EXTERNAL_FAILURE", message, cause);
        this.timeout = timeout;
    }

    public ExternalCallException(String message) {
        super("EXTERNAL_FAILURE", message);
        this.timeout = false;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
