package com.flagship.card_autopay.webhook;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

@Value
@AllArgsConstructor
public class WebhookResult {
    String eventId;
    WebhookOutcome outcome;
    /** Payment the event was matched to, if any. */
    UUID paymentId;
    String detail;

    WebhookResult(String eventId, WebhookOutcome outcome, UUID paymentId) {
        this(eventId, outcome, paymentId, null);
    }
}
