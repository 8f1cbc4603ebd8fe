package com.flagship.card_autopay.payment;

import com.flagship.card_autopay.observability.AutopayMetrics;
import com.flagship.card_autopay.payment.dto.CreatePaymentRequest;
import com.flagship.card_autopay.payment.dto.PaymentResponse;
import com.flagship.card_autopay.schedule.PaymentScheduler;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * REST controller for payments and scheduled payment intents.
 *
 * Creating a payment is idempotent when the client sends an {@code Idempotency-Key} header:
 * repeating the request returns the payment created the first time.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Validated
@Slf4j
public class PaymentController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PaymentLifecycleService lifecycle;
    private final PaymentScheduler scheduler;
    private final AutopayMetrics metrics;

    /**
     * Creates an immediate payment and, unless {@code submit} is false, submits it to the gateway.
     * A gateway outage does not fail the request: the payment comes back PENDING with
     * {@code last_error} set and can be retried through {@code /submit}.
     */
    @PostMapping
    public ResponseEntity<PaymentResponse> createPayment(
            @Valid @RequestBody CreatePaymentRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        long startTime = System.currentTimeMillis();
        log.info("Received payment request: cardId={}, preference={}, amount={}, idempotencyKey={}",
            request.getCardId(), request.getPreference(), request.getAmount(), idempotencyKey);

        Payment payment = lifecycle.createImmediate(request.getCardId(), request.getPreference(),
            request.getAmount(), idempotencyKey);
        if (request.shouldSubmit() && payment.getStatus() == PaymentStatus.PENDING) {
            payment = lifecycle.submit(payment.getId());
        }

        metrics.recordLatency("create", System.currentTimeMillis() - startTime);
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }

    @GetMapping("/{id}")
    public PaymentResponse getPayment(@PathVariable("id") UUID id) {
        return PaymentResponse.from(lifecycle.getPayment(id));
    }

    /**
     * Retries gateway submission of a PENDING payment.
     */
    @PostMapping("/{id}/submit")
    public PaymentResponse submitPayment(@PathVariable("id") UUID id) {
        return PaymentResponse.from(lifecycle.submit(id));
    }

    @PostMapping("/{id}/cancel")
    public PaymentResponse cancelPayment(@PathVariable("id") UUID id) {
        return PaymentResponse.from(lifecycle.cancel(id));
    }

    /**
     * In-flight payments plus scheduled intents firing within the horizon, soonest first.
     */
    @GetMapping("/upcoming")
    public List<PaymentResponse> upcoming(
            @RequestParam(name = "hours_ahead", defaultValue = "72") @Min(1) @Max(8760) int hoursAhead) {
        Instant until = scheduler.now().plus(Duration.ofHours(hoursAhead));
        return Stream.concat(
                lifecycle.listInFlight().stream().map(PaymentResponse::from),
                scheduler.listUpcoming(until).stream().map(PaymentResponse::from))
            .sorted(Comparator.comparing(PaymentController::timelineKey, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    }

    @GetMapping("/history")
    public List<PaymentResponse> history(
            @RequestParam(name = "card_id", required = false) UUID cardId,
            @RequestParam(name = "status", required = false) Set<PaymentStatus> statuses) {
        return lifecycle.history(cardId, statuses).stream().map(PaymentResponse::from).toList();
    }

    @DeleteMapping("/schedules/{scheduleId}")
    public ResponseEntity<Void> cancelScheduledPayment(@PathVariable("scheduleId") UUID scheduleId) {
        scheduler.cancelScheduled(scheduleId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Fires a due schedule now instead of waiting for the periodic job. Rejected with 409 if the
     * scheduled time has not been reached.
     */
    @PostMapping("/schedules/{scheduleId}/fire")
    public PaymentResponse fireSchedule(@PathVariable("scheduleId") UUID scheduleId) {
        Payment payment = scheduler.fire(scheduleId, scheduler.now());
        if (payment.getStatus() == PaymentStatus.PENDING) {
            payment = lifecycle.submit(payment.getId());
        }
        return PaymentResponse.from(payment);
    }

    private static Instant timelineKey(PaymentResponse response) {
        return response.getScheduledDate() != null ? response.getScheduledDate() : response.getCreatedAt();
    }
}
