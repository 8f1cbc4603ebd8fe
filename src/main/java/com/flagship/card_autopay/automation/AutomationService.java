package com.flagship.card_autopay.automation;

import com.flagship.card_autopay.card.Card;
import com.flagship.card_autopay.card.CardRegistry;
import com.flagship.card_autopay.card.PaymentPreference;
import com.flagship.card_autopay.schedule.PaymentScheduler;
import com.flagship.card_autopay.schedule.ScheduledPayment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns autopay on or off for a card and keeps its automatic schedule in step.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutomationService {

    private final CardRegistry cardRegistry;
    private final PaymentScheduler scheduler;

    /**
     * Stores the automation settings, then schedules the next automatic payment if the card's
     * data allows one.
     *
     * @throws com.flagship.card_autopay.card.InvalidPreferenceException if CUSTOM_AMOUNT has no
     *         positive amount or the buffer is outside 0..720 hours
     */
    public AutomationState enable(UUID cardId, PaymentPreference preference, BigDecimal customAmount,
                                  int bufferHours) {
        Card card = cardRegistry.enableAutomation(cardId, preference, customAmount, bufferHours);
        Optional<ScheduledPayment> next = scheduler.refreshAutomaticSchedule(card);
        next.ifPresent(schedule -> log.info("Next automatic payment for card {} at {}",
            cardId, schedule.getScheduledDate()));
        return new AutomationState(card, next.orElse(null));
    }

    public Card disable(UUID cardId) {
        Card card = cardRegistry.disableAutomation(cardId);
        scheduler.removeAutomaticSchedules(cardId);
        return card;
    }
}
