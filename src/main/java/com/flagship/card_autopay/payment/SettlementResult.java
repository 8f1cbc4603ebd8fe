package com.flagship.card_autopay.payment;

import lombok.Value;

/**
 * Payment state after a settle call. {@code applied} is false when the payment was already
 * terminal and the settlement was absorbed as a no-op.
 */
@Value
public class SettlementResult {
    Payment payment;
    boolean applied;
}
