package com.flagship.card_autopay.payment;

import com.flagship.card_autopay.common.exception.StateConflictException;

import java.util.UUID;

/**
 * A gateway transaction id is already attached to a different payment.
 */
public class DuplicateTransactionException extends StateConflictException {

    public DuplicateTransactionException(String transactionId, UUID ownerPaymentId, UUID targetPaymentId) {
        super("DUPLICATE_TRANSACTION", String.format(
            "Transaction %s already belongs to payment %s, refusing to attach it to %s",
            transactionId, ownerPaymentId, targetPaymentId));
    }
}
