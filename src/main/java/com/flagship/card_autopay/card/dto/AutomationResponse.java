package com.flagship.card_autopay.card.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.card_autopay.automation.AutomationState;
import com.flagship.card_autopay.payment.dto.ScheduledPaymentResponse;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AutomationResponse {

    @JsonProperty("card")
    CardResponse card;

    @JsonProperty("next_payment")
    ScheduledPaymentResponse nextPayment;

    public static AutomationResponse from(AutomationState state) {
        return new AutomationResponse(CardResponse.from(state.getCard()),
            state.getNextPayment() != null ? ScheduledPaymentResponse.from(state.getNextPayment()) : null);
    }
}
