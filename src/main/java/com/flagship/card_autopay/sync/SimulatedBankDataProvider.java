package com.flagship.card_autopay.sync;

import com.flagship.card_autopay.card.CardSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Produces a plausible statement for any card id: the same card always gets the same balance,
 * due roughly two weeks out.
 */
@Component
@ConditionalOnProperty(name = "autopay.simulation.bank.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SimulatedBankDataProvider implements BankDataProvider {

    private static final BigDecimal MINIMUM_DUE_RATIO = new BigDecimal("0.05");

    private final Clock clock;

    public SimulatedBankDataProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CardSnapshot fetchCardSnapshot(UUID cardId) {
        Instant now = clock.instant();
        long seed = Math.abs(cardId.getLeastSignificantBits() % 90_000L);
        BigDecimal balance = BigDecimal.valueOf(10_000L + seed, 0).setScale(2, RoundingMode.HALF_UP);
        BigDecimal minimumDue = balance.multiply(MINIMUM_DUE_RATIO).setScale(2, RoundingMode.HALF_UP);

        CardSnapshot snapshot = CardSnapshot.builder()
            .currentBalance(balance)
            .minimumDue(minimumDue)
            .totalDue(balance)
            .paymentDueDate(now.plus(Duration.ofDays(14)).truncatedTo(ChronoUnit.DAYS))
            .asOf(now)
            .build();
        log.debug("Simulated bank statement for card {}: totalDue={}, minimumDue={}", cardId, balance, minimumDue);
        return snapshot;
    }
}
