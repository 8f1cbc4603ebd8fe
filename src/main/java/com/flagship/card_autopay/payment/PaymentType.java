package com.flagship.card_autopay.payment;

public enum PaymentType {
    /** Computed and scheduled by the automation rules. */
    AUTOMATIC,
    /** Requested explicitly by the user, immediately or for a chosen date. */
    MANUAL
}
