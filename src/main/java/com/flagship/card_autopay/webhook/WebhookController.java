package com.flagship.card_autopay.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives payment gateway callbacks.
 *
 * Any 2xx tells the gateway to stop redelivering, so duplicates, unknown payments and ignored
 * types all answer 200. Unexpected failures answer 5xx and are redelivered.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final WebhookReconciler reconciler;

    @PostMapping("/gateway")
    public ResponseEntity<WebhookResponse> receive(@RequestBody String payload) {
        WebhookResult result = reconciler.handle(payload);
        log.debug("Webhook {} handled: {}", result.getEventId(), result.getOutcome());
        return ResponseEntity.ok(new WebhookResponse(result.getEventId(), result.getOutcome(), result.getPaymentId() != null
            ? result.getPaymentId().toString() : null));
    }

    @Value
    public static class WebhookResponse {
        @JsonProperty("event_id")
        String eventId;

        @JsonProperty("outcome")
        WebhookOutcome outcome;

        @JsonProperty("payment_id")
        String paymentId;
    }
}
