package com.flagship.card_autopay.webhook;

import com.flagship.card_autopay.card.CardSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Card balance facts piggybacked on a gateway webhook.
 */
@Value
@Builder
public class CardMetadata {
    /** May be absent; the matched payment's card is used then. */
    UUID cardId;
    BigDecimal minimumDue;
    BigDecimal totalDue;
    Instant dueDate;
    BigDecimal currentBalance;
    /** When the gateway observed these facts. */
    Instant updatedAt;

    public CardSnapshot toSnapshot(Instant asOf) {
        return CardSnapshot.builder()
            .minimumDue(minimumDue)
            .totalDue(totalDue)
            .paymentDueDate(dueDate)
            .currentBalance(currentBalance)
            .asOf(asOf)
            .build();
    }
}
