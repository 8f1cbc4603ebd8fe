package com.flagship.card_autopay.webhook;

import com.flagship.card_autopay.card.CardNotFoundException;
import com.flagship.card_autopay.card.CardRegistry;
import com.flagship.card_autopay.common.exception.InvalidTransitionException;
import com.flagship.card_autopay.observability.AutopayMetrics;
import com.flagship.card_autopay.observability.CorrelationContext;
import com.flagship.card_autopay.payment.DuplicateTransactionException;
import com.flagship.card_autopay.payment.GatewaySettlement;
import com.flagship.card_autopay.payment.Payment;
import com.flagship.card_autopay.payment.PaymentLifecycleService;
import com.flagship.card_autopay.payment.SettlementResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Applies gateway callbacks to local payment and card state.
 *
 * Each event id is handled at most once. An event is recorded as processed only after it was
 * handled without an unexpected error; otherwise the exception propagates, the gateway gets a
 * non-2xx response and redelivers.
 *
 * Card metadata carried on the event is folded into the card whenever it is newer than the
 * card's last sync, whatever happened to the payment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookReconciler {

    private final WebhookEventParser parser;
    private final WebhookDeduplicator deduplicator;
    private final PaymentLifecycleService lifecycle;
    private final CardRegistry cardRegistry;
    private final AutopayMetrics metrics;

    /**
     * @throws MalformedWebhookException if the body cannot be parsed
     */
    public WebhookResult handle(String rawPayload) {
        WebhookEvent event = parser.parse(rawPayload);

        try (CorrelationContext.Scope ignored = CorrelationContext.put(CorrelationContext.EVENT_ID_MDC_KEY, event.getEventId())) {
            if (deduplicator.isAlreadyProcessed(event.getEventId())) {
                log.info("Webhook {} already processed, skipping", event.getEventId());
                metrics.recordWebhook(event.getRawType(), WebhookOutcome.DUPLICATE.name());
                return new WebhookResult(event.getEventId(), WebhookOutcome.DUPLICATE, null);
            }

            try {
                WebhookResult result = apply(event);
                deduplicator.record(ProcessedWebhook.of(event, result.getPaymentId(), result.getOutcome(), result.getDetail()));
                metrics.recordWebhook(event.getRawType(), result.getOutcome().name());
                return result;
            } catch (RuntimeException e) {
                metrics.recordWebhook(event.getRawType(), "error");
                log.error("Webhook {} ({}) failed, leaving it for redelivery: {}. Payload: {}",
                    event.getEventId(), event.getRawType(), e.getMessage(), event.getRawPayload(), e);
                throw e;
            }
        }
    }

    private WebhookResult apply(WebhookEvent event) {
        if (event.getType() == WebhookEventType.UNKNOWN) {
            log.info("Ignoring webhook of unhandled type {}", event.getRawType());
            return new WebhookResult(event.getEventId(), WebhookOutcome.IGNORED, null,
                "unhandled type " + event.getRawType());
        }

        Payment payment;
        try {
            payment = locate(event);
        } catch (UnknownPaymentException e) {
            log.warn(e.getMessage());
            if (event.getCardMetadata() != null && event.getCardMetadata().getCardId() != null) {
                foldInMetadata(event, event.getCardMetadata().getCardId());
            }
            return new WebhookResult(event.getEventId(), WebhookOutcome.UNKNOWN_PAYMENT, null, e.getMessage());
        }

        WebhookResult result = settle(event, payment);

        if (event.getCardMetadata() != null) {
            UUID cardId = event.getCardMetadata().getCardId() != null
                ? event.getCardMetadata().getCardId()
                : payment.getCardId();
            foldInMetadata(event, cardId);
        }
        return result;
    }

    private Payment locate(WebhookEvent event) {
        return lifecycle.findByGatewayReference(event.getOrderId(), event.getTransactionId(), event.getPaymentReference())
            .orElseThrow(() -> new UnknownPaymentException(event.getEventId(), event.getOrderId(), event.getTransactionId()));
    }

    private WebhookResult settle(WebhookEvent event, Payment payment) {
        GatewaySettlement settlement = event.getType() == WebhookEventType.PAYMENT_CAPTURED
            ? GatewaySettlement.captured(event.getTransactionId())
            : GatewaySettlement.failed(event.getTransactionId(), event.getFailureReason());

        try {
            SettlementResult result = lifecycle.settle(payment.getId(), settlement);
            WebhookOutcome outcome = result.isApplied() ? WebhookOutcome.APPLIED : WebhookOutcome.NO_OP;
            return new WebhookResult(event.getEventId(), outcome, payment.getId(),
                "payment " + result.getPayment().getStatus());
        } catch (InvalidTransitionException | DuplicateTransactionException e) {
            log.warn("Webhook {} not applied to payment {}: {}", event.getEventId(), payment.getId(), e.getMessage());
            return new WebhookResult(event.getEventId(), WebhookOutcome.NO_OP, payment.getId(), e.getMessage());
        }
    }

    private void foldInMetadata(WebhookEvent event, UUID cardId) {
        try {
            cardRegistry.foldInSnapshot(cardId, event.getCardMetadata().toSnapshot(event.metadataTimestamp()));
        } catch (CardNotFoundException e) {
            log.warn("Webhook {} carries metadata for unknown card {}", event.getEventId(), cardId);
        } catch (IllegalArgumentException e) {
            log.warn("Webhook {} carries invalid card metadata: {}", event.getEventId(), e.getMessage());
        }
    }
}
