package com.flagship.card_autopay.webhook;

public enum WebhookEventType {
    PAYMENT_CAPTURED("payment.captured"),
    PAYMENT_FAILED("payment.failed"),
    UNKNOWN("unknown");

    private final String wireName;

    WebhookEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static WebhookEventType fromWire(String value) {
        for (WebhookEventType type : values()) {
            if (type != UNKNOWN && type.wireName.equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
