package com.flagship.card_autopay.schedule;

import lombok.Value;

/**
 * Tally of one {@code fireDuePayments} run.
 */
@Value
public class FiringSummary {
    int fired;
    int submitted;
    int dropped;
    int failed;

    public int total() {
        return fired + dropped + failed;
    }
}
