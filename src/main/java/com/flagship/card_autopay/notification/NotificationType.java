package com.flagship.card_autopay.notification;

public enum NotificationType {
    PAYMENT_REMINDER("payment_reminder"),
    PAYMENT_COMPLETED("payment_completed"),
    PAYMENT_FAILED("payment_failed"),
    CARD_SYNC_ERROR("card_sync_error");

    private final String wireName;

    NotificationType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
