package com.flagship.card_autopay.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Parses the gateway webhook body:
 * <pre>
 * {
 *   "id": "evt_...",
 *   "type": "payment.captured",
 *   "created_at": "2024-06-08T10:00:00Z",
 *   "payload": {
 *     "order_id": "order_...",
 *     "transaction_id": "pay_...",
 *     "notes": { "payment_id": "&lt;local payment uuid&gt;" },
 *     "error_description": "...",
 *     "card_metadata": {
 *       "card_id": "...", "minimum_due": 500, "total_due": 1000,
 *       "due_date": "...", "current_balance": 1200, "updated_at": "..."
 *     }
 *   }
 * }
 * </pre>
 * Unknown fields are ignored. Only {@code id} and {@code type} are required.
 */
@Component
@RequiredArgsConstructor
public class WebhookEventParser {

    private final ObjectMapper objectMapper;

    public WebhookEvent parse(String rawPayload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            throw new MalformedWebhookException("Webhook body is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new MalformedWebhookException("Webhook body must be a JSON object");
        }

        String eventId = text(root, "id");
        if (eventId == null || eventId.isBlank()) {
            throw new MalformedWebhookException("Webhook is missing its event id");
        }
        String rawType = text(root, "type");
        if (rawType == null) {
            throw new MalformedWebhookException("Webhook " + eventId + " is missing its type");
        }

        JsonNode payload = root.path("payload");
        return WebhookEvent.builder()
            .eventId(eventId)
            .type(WebhookEventType.fromWire(rawType))
            .rawType(rawType)
            .orderId(text(payload, "order_id"))
            .transactionId(text(payload, "transaction_id"))
            .paymentReference(uuid(payload.path("notes"), "payment_id"))
            .failureReason(text(payload, "error_description"))
            .cardMetadata(metadata(payload.path("card_metadata")))
            .createdAt(instant(root, "created_at"))
            .rawPayload(rawPayload)
            .build();
    }

    private CardMetadata metadata(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || !node.isObject()) {
            return null;
        }
        return CardMetadata.builder()
            .cardId(uuid(node, "card_id"))
            .minimumDue(decimal(node, "minimum_due"))
            .totalDue(decimal(node, "total_due"))
            .dueDate(instant(node, "due_date"))
            .currentBalance(decimal(node, "current_balance"))
            .updatedAt(instant(node, "updated_at"))
            .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        try {
            return new BigDecimal(value.asText());
        } catch (NumberFormatException e) {
            throw new MalformedWebhookException("Field " + field + " is not a number: " + value.asText());
        }
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new MalformedWebhookException("Field " + field + " is not an ISO-8601 instant: " + value);
        }
    }

    private static UUID uuid(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            // Notes are free-form on the gateway side; a non-UUID reference just doesn't match anything
            return null;
        }
    }
}
