package com.flagship.card_autopay.automation;

import com.flagship.card_autopay.card.Card;
import com.flagship.card_autopay.schedule.ScheduledPayment;
import lombok.Value;

/**
 * A card right after its automation settings changed, with the automatic schedule that resulted.
 */
@Value
public class AutomationState {
    Card card;
    /** Null when no payment could be scheduled yet (no sync, nothing due). */
    ScheduledPayment nextPayment;
}
