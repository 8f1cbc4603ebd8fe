package com.flagship.card_autopay.webhook;

/**
 * What handling a webhook did.
 */
public enum WebhookOutcome {
    /** The settlement changed the payment. */
    APPLIED,
    /** The event id was seen before; nothing was done. */
    DUPLICATE,
    /** No local payment matches the event. */
    UNKNOWN_PAYMENT,
    /** The event type is not one we act on. */
    IGNORED,
    /** The payment was already terminal, or the settlement was refused by the state machine. */
    NO_OP
}
