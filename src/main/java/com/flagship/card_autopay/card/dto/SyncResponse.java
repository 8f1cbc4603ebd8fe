package com.flagship.card_autopay.card.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.card_autopay.sync.SyncResult;
import lombok.Value;

import java.util.UUID;

@Value
public class SyncResponse {

    @JsonProperty("card_id")
    UUID cardId;

    @JsonProperty("outcome")
    SyncResult.Outcome outcome;

    @JsonProperty("error")
    String error;

    @JsonProperty("card")
    CardResponse card;

    public static SyncResponse from(SyncResult result) {
        return new SyncResponse(result.getCardId(), result.getOutcome(), result.getError(),
            result.getCard() != null ? CardResponse.from(result.getCard()) : null);
    }
}
