package com.flagship.card_autopay.card;

import com.flagship.card_autopay.automation.AutomationService;
import com.flagship.card_autopay.automation.AutomationState;
import com.flagship.card_autopay.card.dto.AddCardRequest;
import com.flagship.card_autopay.card.dto.AutomationResponse;
import com.flagship.card_autopay.card.dto.CardResponse;
import com.flagship.card_autopay.card.dto.EnableAutomationRequest;
import com.flagship.card_autopay.card.dto.SyncResponse;
import com.flagship.card_autopay.payment.PaymentLifecycleService;
import com.flagship.card_autopay.payment.dto.PaymentResponse;
import com.flagship.card_autopay.payment.dto.ScheduleRequest;
import com.flagship.card_autopay.payment.dto.ScheduledPaymentResponse;
import com.flagship.card_autopay.schedule.PaymentScheduler;
import com.flagship.card_autopay.schedule.ScheduledPayment;
import com.flagship.card_autopay.sync.SyncCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for linked cards: registration, bank sync, automation settings and the
 * card's payments and schedules.
 */
@RestController
@RequestMapping("/api/cards")
@RequiredArgsConstructor
@Slf4j
public class CardController {

    private final CardRegistry cardRegistry;
    private final SyncCoordinator syncCoordinator;
    private final AutomationService automationService;
    private final PaymentScheduler scheduler;
    private final PaymentLifecycleService lifecycle;

    @PostMapping
    public ResponseEntity<CardResponse> addCard(@Valid @RequestBody AddCardRequest request) {
        Card card = cardRegistry.addCard(request.getIssuingBank(), request.getNetworkBrand(), request.getLast4(),
            request.getCreditLimit(), request.getInterestRate(), request.getLateFeeAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(CardResponse.from(card));
    }

    @GetMapping
    public List<CardResponse> listCards() {
        return cardRegistry.listCards().stream().map(CardResponse::from).toList();
    }

    @GetMapping("/{id}")
    public CardResponse getCard(@PathVariable("id") UUID id) {
        return CardResponse.from(cardRegistry.getCard(id));
    }

    /**
     * Syncs one card with its bank. A bank failure still answers 200 with outcome FAILED;
     * a sync already in flight answers 409.
     */
    @PostMapping("/{id}/sync")
    public SyncResponse sync(@PathVariable("id") UUID id) {
        return SyncResponse.from(syncCoordinator.requestSync(id));
    }

    @PostMapping("/sync")
    public List<SyncResponse> syncAll() {
        return syncCoordinator.syncAllCards().stream().map(SyncResponse::from).toList();
    }

    @PutMapping("/{id}/automation")
    public AutomationResponse enableAutomation(@PathVariable("id") UUID id,
                                               @Valid @RequestBody EnableAutomationRequest request) {
        AutomationState state = automationService.enable(id, request.getPaymentPreference(),
            request.getCustomAmount(), request.getBufferHours());
        return AutomationResponse.from(state);
    }

    @DeleteMapping("/{id}/automation")
    public CardResponse disableAutomation(@PathVariable("id") UUID id) {
        return CardResponse.from(automationService.disable(id));
    }

    /**
     * Schedules a payment. An empty body computes the next automatic payment from the card's
     * automation rules.
     */
    @PostMapping("/{id}/schedules")
    public ResponseEntity<ScheduledPaymentResponse> schedulePayment(@PathVariable("id") UUID id,
                                                                    @Valid @RequestBody(required = false) ScheduleRequest request) {
        ScheduledPayment schedule = request != null && request.isManual()
            ? scheduler.scheduleManual(id, request.getScheduledDate(), request.getAmount())
            : scheduler.scheduleAutomatic(id);
        return ResponseEntity.status(HttpStatus.CREATED).body(ScheduledPaymentResponse.from(schedule));
    }

    @GetMapping("/{id}/schedules")
    public List<ScheduledPaymentResponse> listSchedules(@PathVariable("id") UUID id) {
        cardRegistry.getCard(id);
        return scheduler.listByCard(id).stream().map(ScheduledPaymentResponse::from).toList();
    }

    @GetMapping("/{id}/payments")
    public List<PaymentResponse> listPayments(@PathVariable("id") UUID id) {
        return lifecycle.listByCard(id).stream().map(PaymentResponse::from).toList();
    }
}
