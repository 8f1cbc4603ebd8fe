package com.flagship.card_autopay.webhook;

import com.flagship.card_autopay.common.exception.ResourceNotFoundException;

/**
 * A webhook references no payment we know about.
 */
public class UnknownPaymentException extends ResourceNotFoundException {

    public UnknownPaymentException(String eventId, String orderId, String transactionId) {
        super("UNKNOWN_PAYMENT", String.format(
            "Webhook %s matches no payment (orderId=%s, transactionId=%s)", eventId, orderId, transactionId));
    }
}
