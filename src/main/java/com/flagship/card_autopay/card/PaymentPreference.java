package com.flagship.card_autopay.card;

/**
 * How much an automatic or immediate payment should cover.
 */
public enum PaymentPreference {
    MINIMUM_DUE,
    TOTAL_DUE,
    CUSTOM_AMOUNT
}
