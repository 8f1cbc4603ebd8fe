package com.flagship.card_autopay.payment;

import com.flagship.card_autopay.automation.AutomationRuleEvaluator;
import com.flagship.card_autopay.automation.SavingsEstimate;
import com.flagship.card_autopay.card.Card;
import com.flagship.card_autopay.card.CardRegistry;
import com.flagship.card_autopay.card.PaymentPreference;
import com.flagship.card_autopay.common.concurrency.EntityLockRegistry;
import com.flagship.card_autopay.common.concurrency.ExternalCallGuard;
import com.flagship.card_autopay.common.exception.InvalidTransitionException;
import com.flagship.card_autopay.common.exception.StaleWriteException;
import com.flagship.card_autopay.notification.LifecycleNotification;
import com.flagship.card_autopay.notification.NotificationDispatcher;
import com.flagship.card_autopay.observability.AutopayMetrics;
import com.flagship.card_autopay.observability.CorrelationContext;
import com.flagship.card_autopay.schedule.ScheduledPayment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives payments from creation through gateway submission to settlement.
 *
 * Every state change for a payment happens under that payment's entity lock, including the
 * gateway call in {@link #submit}, so a webhook that races a submission waits for it instead
 * of interleaving. Notifications are queued after the new state is stored and never affect it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentLifecycleService {

    static final String LOCK_SCOPE = "payment";
    private static final BigDecimal MAX_CREDIT_LIMIT_MULTIPLE = BigDecimal.TEN;

    private final PaymentStore paymentStore;
    private final CardRegistry cardRegistry;
    private final AutomationRuleEvaluator ruleEvaluator;
    private final PaymentGatewayClient gatewayClient;
    private final ExternalCallGuard externalCalls;
    private final EntityLockRegistry locks;
    private final NotificationDispatcher notifications;
    private final AutopayMetrics metrics;
    private final Clock clock;

    /**
     * Creates a PENDING manual payment for the card.
     *
     * A repeated call with the same idempotency key returns the payment created by the first call.
     *
     * @param amount explicit amount, or null to use what {@code preference} resolves to
     * @throws InvalidAmountException if the amount is not positive or exceeds ten times the credit limit
     */
    public Payment createImmediate(UUID cardId, PaymentPreference preference, BigDecimal amount,
                                   String idempotencyKey) {
        if (idempotencyKey != null) {
            Optional<Payment> existing = paymentStore.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                log.info("Idempotency key {} already used by payment {}", idempotencyKey, existing.get().getId());
                return existing.get();
            }
        }

        Card card = cardRegistry.getCard(cardId);
        BigDecimal resolved = amount != null
            ? amount
            : ruleEvaluator.resolveAmount(card, preference, card.getCustomAmount());
        validateAmount(card, resolved);

        Payment payment = Payment.pending(cardId, resolved, preference, PaymentType.MANUAL, null,
            card.getPaymentDueDate(), idempotencyKey);
        try {
            Payment saved = paymentStore.insert(payment);
            metrics.recordPaymentCreated(PaymentType.MANUAL.name());
            log.info("Created immediate payment {} for card {}: amount={}, preference={}",
                saved.getId(), cardId, resolved, preference);
            return saved;
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey == null) {
                throw e;
            }
            // Lost the race against a concurrent request with the same key
            return paymentStore.findByIdempotencyKey(idempotencyKey).orElseThrow(() -> e);
        }
    }

    /**
     * Materializes a fired schedule as a PENDING payment. At most one payment exists per schedule.
     */
    public Payment createFromSchedule(ScheduledPayment schedule) {
        Optional<Payment> existing = paymentStore.findByScheduleId(schedule.getScheduleId());
        if (existing.isPresent()) {
            return existing.get();
        }
        Payment payment = Payment.pending(schedule.getCardId(), schedule.getScheduledAmount(),
            schedule.getPreference(), schedule.getPaymentType(), schedule.getScheduleId(),
            schedule.getDueDate(), null);
        try {
            Payment saved = paymentStore.insert(payment);
            metrics.recordPaymentCreated(schedule.getPaymentType().name());
            log.info("Created payment {} from schedule {}: amount={}", saved.getId(),
                schedule.getScheduleId(), saved.getAmount());
            return saved;
        } catch (DataIntegrityViolationException e) {
            return paymentStore.findByScheduleId(schedule.getScheduleId()).orElseThrow(() -> e);
        }
    }

    /**
     * Submits a PENDING payment to the gateway.
     *
     * On success the payment moves to PROCESSING with the gateway order id. If the gateway is
     * unreachable or the call times out, the payment stays PENDING with the error recorded and
     * can be submitted again. Submitting a payment that is already PROCESSING returns it unchanged.
     *
     * @throws InvalidTransitionException if the payment is terminal
     */
    public Payment submit(UUID paymentId) {
        return locks.withLock(LOCK_SCOPE, paymentId, () -> {
            try (CorrelationContext.Scope ignored = CorrelationContext.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId)) {
                long startTime = System.currentTimeMillis();
                Payment payment = load(paymentId);

                if (payment.getStatus() == PaymentStatus.PROCESSING) {
                    log.info("Payment already submitted as order {}", payment.getGatewayOrderId());
                    return payment;
                }
                if (payment.getStatus() != PaymentStatus.PENDING) {
                    throw InvalidTransitionException.of(
                        "payment", paymentId, payment.getStatus(), PaymentStatus.PROCESSING);
                }

                Payment updated;
                try {
                    GatewayOrder order = externalCalls.call(ExternalCallGuard.GATEWAY_SUBMIT,
                        () -> gatewayClient.submitPayment(paymentId, payment.getCardId(), payment.getAmount()));
                    updated = paymentStore.update(payment.markProcessing(order.getOrderId()));
                    metrics.recordSubmission("accepted");
                    log.info("Payment submitted: orderId={}, amount={}", order.getOrderId(), payment.getAmount());
                } catch (StaleWriteException e) {
                    throw e;
                } catch (RuntimeException e) {
                    String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    updated = paymentStore.update(payment.recordSubmissionFailure(error));
                    metrics.recordSubmission("failed");
                    log.warn("Payment submission failed, left PENDING for retry: {}", error);
                }
                metrics.recordLatency("submit", System.currentTimeMillis() - startTime);
                return updated;
            }
        });
    }

    /**
     * Applies a gateway settlement.
     *
     * PROCESSING (or PENDING, when the webhook overtakes the submit response) moves to
     * COMPLETED on capture, with savings computed from the card's current snapshot. A failure
     * moves PROCESSING to FAILED. A payment that is already terminal is returned unchanged.
     *
     * @throws DuplicateTransactionException if the transaction id belongs to another payment
     * @throws InvalidTransitionException if the
     *         settlement is not permitted from the current state
     */
    public SettlementResult settle(UUID paymentId, GatewaySettlement settlement) {
        return locks.withLock(LOCK_SCOPE, paymentId, () -> {
            try (CorrelationContext.Scope ignored = CorrelationContext.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId)) {
                long startTime = System.currentTimeMillis();
                Payment payment = load(paymentId);

                if (payment.isTerminal()) {
                    log.info("Payment already {}, ignoring {} settlement", payment.getStatus(), settlement.getOutcome());
                    metrics.recordSettlement("already_terminal");
                    return new SettlementResult(payment, false);
                }

                ensureTransactionUnused(settlement.getTransactionId(), paymentId);

                Instant now = clock.instant();
                Payment settled = switch (settlement.getOutcome()) {
                    case CAPTURED -> {
                        Card card = cardRegistry.getCard(payment.getCardId());
                        SavingsEstimate savings = ruleEvaluator.estimateSavings(card, payment.getAmount(), now);
                        yield payment.complete(settlement.getTransactionId(),
                            savings.getInterestSaved(), savings.getLateFeePrevented(), now);
                    }
                    case FAILED -> payment.fail(settlement.getTransactionId(), settlement.getFailureReason(), now);
                };

                Payment saved = paymentStore.update(settled);
                metrics.recordSettlement(saved.getStatus().name());
                metrics.recordLatency("settle", System.currentTimeMillis() - startTime);
                log.info("Payment settled: status={}, transactionId={}, interestSaved={}, lateFeePrevented={}",
                    saved.getStatus(), saved.getTransactionId(), saved.getInterestSaved(), saved.getLateFeePrevented());

                notifications.dispatch(saved.getStatus() == PaymentStatus.COMPLETED
                    ? LifecycleNotification.paymentCompleted(saved.getCardId(), saved.getId(), saved.getAmount(), now)
                    : LifecycleNotification.paymentFailed(saved.getCardId(), saved.getId(), saved.getAmount(),
                        saved.getFailureReason(), now));
                return new SettlementResult(saved, true);
            }
        });
    }

    /**
     * Cancels a SCHEDULED or PENDING payment.
     *
     * @throws InvalidTransitionException otherwise
     */
    public Payment cancel(UUID paymentId) {
        return locks.withLock(LOCK_SCOPE, paymentId, () -> {
            Payment payment = load(paymentId);
            Payment cancelled = paymentStore.update(payment.cancel(clock.instant()));
            metrics.recordPaymentCancelled();
            log.info("Payment {} cancelled (was {})", paymentId, payment.getStatus());
            return cancelled;
        });
    }

    public Payment getPayment(UUID paymentId) {
        return load(paymentId);
    }

    public List<Payment> listByCard(UUID cardId) {
        cardRegistry.getCard(cardId);
        return paymentStore.findByCardId(cardId);
    }

    /**
     * PENDING and PROCESSING payments, newest first.
     */
    public List<Payment> listInFlight() {
        return paymentStore.findByStatusIn(EnumSet.of(PaymentStatus.PENDING, PaymentStatus.PROCESSING));
    }

    /**
     * Payment history, newest first, optionally narrowed to one card and/or a set of statuses.
     */
    public List<Payment> history(UUID cardId, Collection<PaymentStatus> statuses) {
        Collection<PaymentStatus> wanted = statuses == null || statuses.isEmpty()
            ? EnumSet.allOf(PaymentStatus.class)
            : statuses;
        List<Payment> source = cardId != null ? listByCard(cardId) : paymentStore.findByStatusIn(wanted);
        return source.stream()
            .filter(payment -> wanted.contains(payment.getStatus()))
            .toList();
    }

    /**
     * Resolves the payment a gateway callback refers to: by order id, then transaction id,
     * then the local payment reference echoed back in the order notes.
     */
    public Optional<Payment> findByGatewayReference(String orderId, String transactionId, UUID paymentReference) {
        Optional<Payment> payment = Optional.empty();
        if (orderId != null) {
            payment = paymentStore.findByGatewayOrderId(orderId);
        }
        if (payment.isEmpty() && transactionId != null) {
            payment = paymentStore.findByTransactionId(transactionId);
        }
        if (payment.isEmpty() && paymentReference != null) {
            payment = paymentStore.findById(paymentReference);
        }
        return payment;
    }

    private void ensureTransactionUnused(String transactionId, UUID paymentId) {
        if (transactionId == null) {
            return;
        }
        paymentStore.findByTransactionId(transactionId)
            .filter(owner -> !owner.getId().equals(paymentId))
            .ifPresent(owner -> {
                log.error("Transaction {} already attached to payment {}", transactionId, owner.getId());
                throw new DuplicateTransactionException(transactionId, owner.getId(), paymentId);
            });
    }

    private void validateAmount(Card card, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("Payment amount must be greater than zero, got " + amount);
        }
        if (card.getCreditLimit() != null && card.getCreditLimit().signum() > 0
                && amount.compareTo(card.getCreditLimit().multiply(MAX_CREDIT_LIMIT_MULTIPLE)) > 0) {
            throw new InvalidAmountException(String.format(
                "Payment amount %s exceeds %s times the credit limit of card %s",
                amount, MAX_CREDIT_LIMIT_MULTIPLE, card.getId()));
        }
    }

    private Payment load(UUID paymentId) {
        return paymentStore.findById(paymentId).orElseThrow(() -> new PaymentNotFoundException(paymentId));
    }
}
