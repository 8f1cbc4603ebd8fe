package com.flagship.card_autopay.automation;

import com.flagship.card_autopay.card.Card;
import com.flagship.card_autopay.card.InvalidPreferenceException;
import com.flagship.card_autopay.card.PaymentPreference;
import com.flagship.card_autopay.payment.InvalidAmountException;
import com.flagship.card_autopay.payment.PaymentType;
import com.flagship.card_autopay.schedule.ScheduledPayment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Pure rules: how much to pay, when to pay it, and what paying on time saved.
 *
 * Nothing here touches storage; callers pass in the card snapshot they hold.
 */
@Component
@RequiredArgsConstructor
public class AutomationRuleEvaluator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    /**
     * Computes the next automatic payment for the card: {@code dueDate - bufferHours}, for the
     * amount the card's preference resolves to.
     *
     * @throws AutomationDisabledException if automation is off
     * @throws InvalidPreferenceException if a custom amount is required but unset
     * @throws MissingDueDateException if the card has no due date
     * @throws InvalidAmountException if nothing is due
     */
    public ScheduledPayment computeNextPayment(Card card) {
        if (!card.isAutomationEnabled()) {
            throw new AutomationDisabledException(card.getId());
        }
        BigDecimal amount = resolveAmount(card, card.getPaymentPreference(), card.getCustomAmount());
        if (card.getPaymentDueDate() == null) {
            throw new MissingDueDateException(card.getId());
        }
        if (amount.signum() <= 0) {
            throw new InvalidAmountException("Nothing is due on card " + card.getId());
        }
        return ScheduledPayment.builder()
            .scheduleId(UUID.randomUUID())
            .cardId(card.getId())
            .scheduledDate(triggerTime(card))
            .scheduledAmount(amount)
            .paymentType(PaymentType.AUTOMATIC)
            .preference(card.getPaymentPreference())
            .dueDate(card.getPaymentDueDate())
            .build();
    }

    public Instant triggerTime(Card card) {
        return card.getPaymentDueDate().minus(Duration.ofHours(card.getBufferHours()));
    }

    /**
     * Resolves the amount a preference asks for against the card's current dues.
     */
    public BigDecimal resolveAmount(Card card, PaymentPreference preference, BigDecimal customAmount) {
        return switch (preference) {
            case MINIMUM_DUE -> nonNull(card.getMinimumDue());
            case TOTAL_DUE -> nonNull(card.getTotalDue());
            case CUSTOM_AMOUNT -> {
                if (customAmount == null || customAmount.signum() <= 0) {
                    throw new InvalidPreferenceException("CUSTOM_AMOUNT requires a custom amount greater than zero");
                }
                yield customAmount;
            }
        };
    }

    /**
     * Savings credited to a payment settled at {@code settledAt}.
     *
     * Zero unless the payment landed on or before the card's due date. Paying at least the
     * minimum due prevents the late fee; the paid share of the total due avoids one month of
     * interest at the card's APR.
     */
    public SavingsEstimate estimateSavings(Card card, BigDecimal amountPaid, Instant settledAt) {
        Instant dueDate = card.getPaymentDueDate();
        if (dueDate == null || settledAt == null || settledAt.isAfter(dueDate)
                || amountPaid == null || amountPaid.signum() <= 0) {
            return SavingsEstimate.NONE;
        }

        BigDecimal lateFee = amountPaid.compareTo(nonNull(card.getMinimumDue())) >= 0
            ? nonNull(card.getLateFeeAmount())
            : BigDecimal.ZERO;

        BigDecimal interestBase = amountPaid.min(nonNull(card.getTotalDue()));
        BigDecimal interest = interestBase
            .multiply(nonNull(card.getInterestRate()))
            .divide(HUNDRED.multiply(MONTHS_PER_YEAR), 2, RoundingMode.HALF_UP);

        return new SavingsEstimate(interest, lateFee.setScale(2, RoundingMode.HALF_UP));
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
