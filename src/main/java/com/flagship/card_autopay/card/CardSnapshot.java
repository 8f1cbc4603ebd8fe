package com.flagship.card_autopay.card;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Bank-sourced balance facts as of a point in time.
 *
 * Produced by a bank sync or by card metadata carried on a gateway webhook.
 * {@code creditLimit} and {@code currentBalance} may be null when the source does not report them.
 */
@Value
@Builder(toBuilder = true)
public class CardSnapshot {
    BigDecimal creditLimit;
    BigDecimal currentBalance;
    BigDecimal minimumDue;
    BigDecimal totalDue;
    Instant paymentDueDate;
    Instant asOf;
}
