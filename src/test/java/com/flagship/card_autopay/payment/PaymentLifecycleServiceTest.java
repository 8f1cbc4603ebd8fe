package com.flagship.card_autopay.payment;

import com.flagship.card_autopay.card.Card;
import com.flagship.card_autopay.card.PaymentPreference;
import com.flagship.card_autopay.common.exception.InvalidTransitionException;
import com.flagship.card_autopay.notification.NotificationType;
import com.flagship.card_autopay.support.AutopayTestHarness;
import com.flagship.card_autopay.support.StubPaymentGatewayClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payment creation, gateway submission and settlement over in-memory storage.
 */
class PaymentLifecycleServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-08T10:00:00Z");
    private static final Instant DUE = Instant.parse("2024-06-10T00:00:00Z");

    private AutopayTestHarness harness;
    private PaymentLifecycleService lifecycle;
    private Card card;

    @BeforeEach
    void setUp() {
        harness = new AutopayTestHarness(NOW);
        lifecycle = harness.lifecycle;
        card = harness.connectedCard(new BigDecimal("500.00"), new BigDecimal("1000.00"), DUE);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    @DisplayName("Immediate payment resolves its amount from the preference")
    void testCreateImmediateResolvesAmount() {
        Payment payment = lifecycle.createImmediate(card.getId(), PaymentPreference.TOTAL_DUE, null, null);

        assertEquals(PaymentStatus.PENDING, payment.getStatus());
        assertEquals(0, new BigDecimal("1000.00").compareTo(payment.getAmount()));
        assertEquals(PaymentType.MANUAL, payment.getPaymentType());
        assertEquals(DUE, payment.getDueDate());
    }

    @Test
    @DisplayName("Zero, negative and absurd amounts are rejected; overpayment is allowed")
    void testCreateImmediateAmountBounds() {
        assertThrows(InvalidAmountException.class,
            () -> lifecycle.createImmediate(card.getId(), PaymentPreference.CUSTOM_AMOUNT, BigDecimal.ZERO, null));
        assertThrows(InvalidAmountException.class,
            () -> lifecycle.createImmediate(card.getId(), PaymentPreference.CUSTOM_AMOUNT, new BigDecimal("-5"), null));
        assertThrows(InvalidAmountException.class,
            () -> lifecycle.createImmediate(card.getId(), PaymentPreference.CUSTOM_AMOUNT, new BigDecimal("1000000.01"), null));

        Payment overpaid = lifecycle.createImmediate(card.getId(), PaymentPreference.CUSTOM_AMOUNT,
            new BigDecimal("5000.00"), null);
        assertEquals(PaymentStatus.PENDING, overpaid.getStatus());
    }

    @Test
    @DisplayName("Same idempotency key returns the same payment")
    void testCreateImmediateIdempotent() {
        Payment first = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, "key-1");
        Payment second = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, "key-1");

        assertEquals(first.getId(), second.getId());
        assertEquals(1, harness.paymentStore.size());
    }

    @Test
    @DisplayName("Submit then captured webhook completes the payment; a repeat settlement is a no-op")
    void testSubmitAndSettleIdempotently() {
        Payment payment = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);

        Payment processing = lifecycle.submit(payment.getId());
        assertEquals(PaymentStatus.PROCESSING, processing.getStatus());
        assertNotNull(processing.getGatewayOrderId());

        SettlementResult first = lifecycle.settle(payment.getId(), GatewaySettlement.captured("tx1"));
        assertTrue(first.isApplied());
        assertEquals(PaymentStatus.COMPLETED, first.getPayment().getStatus());
        assertEquals("tx1", first.getPayment().getTransactionId());
        assertEquals(new BigDecimal("17.50"), first.getPayment().getInterestSaved());
        assertEquals(new BigDecimal("500.00"), first.getPayment().getLateFeePrevented());

        SettlementResult second = lifecycle.settle(payment.getId(), GatewaySettlement.captured("tx1"));
        assertFalse(second.isApplied());
        assertEquals(first.getPayment(), second.getPayment());

        assertEquals(1, harness.notifications.ofType(NotificationType.PAYMENT_COMPLETED).size());
    }

    @Test
    @DisplayName("Gateway failure leaves the payment PENDING with the error, and a retry succeeds")
    void testSubmitGatewayUnreachable() {
        Payment payment = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);
        harness.gateway.setMode(StubPaymentGatewayClient.Mode.UNREACHABLE);

        Payment afterFailure = lifecycle.submit(payment.getId());
        assertEquals(PaymentStatus.PENDING, afterFailure.getStatus());
        assertEquals("Gateway unreachable", afterFailure.getLastError());

        harness.gateway.setMode(StubPaymentGatewayClient.Mode.ACCEPT);
        Payment retried = lifecycle.submit(payment.getId());
        assertEquals(PaymentStatus.PROCESSING, retried.getStatus());
        assertNull(retried.getLastError());
    }

    @Test
    @DisplayName("Gateway timeout leaves the payment PENDING instead of hanging")
    void testSubmitGatewayTimeout() {
        Payment payment = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);
        harness.gateway.setMode(StubPaymentGatewayClient.Mode.SLOW);
        harness.gateway.setSlowMillis(AutopayTestHarness.EXTERNAL_TIMEOUT.toMillis() * 4);

        long start = System.nanoTime();
        Payment afterTimeout = lifecycle.submit(payment.getId());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(PaymentStatus.PENDING, afterTimeout.getStatus());
        assertNotNull(afterTimeout.getLastError());
        assertTrue(elapsedMs < AutopayTestHarness.EXTERNAL_TIMEOUT.toMillis() * 3, "took " + elapsedMs + "ms");
    }

    @Test
    @DisplayName("Submitting a PROCESSING payment is a no-op; submitting a terminal payment is refused")
    void testSubmitStates() {
        Payment payment = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);
        Payment processing = lifecycle.submit(payment.getId());

        Payment again = lifecycle.submit(payment.getId());
        assertEquals(processing.getGatewayOrderId(), again.getGatewayOrderId());
        assertEquals(1, harness.gateway.callCount());

        lifecycle.settle(payment.getId(), GatewaySettlement.captured("tx1"));
        assertThrows(InvalidTransitionException.class, () -> lifecycle.submit(payment.getId()));
    }

    @Test
    @DisplayName("Capture arriving before submit completes a PENDING payment")
    void testSettlePendingCaptured() {
        Payment payment = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);

        SettlementResult result = lifecycle.settle(payment.getId(), GatewaySettlement.captured("tx-early"));

        assertTrue(result.isApplied());
        assertEquals(PaymentStatus.COMPLETED, result.getPayment().getStatus());
    }

    @Test
    @DisplayName("Failure on a PENDING payment is refused")
    void testSettlePendingFailedRefused() {
        Payment payment = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);

        assertThrows(InvalidTransitionException.class,
            () -> lifecycle.settle(payment.getId(), GatewaySettlement.failed("tx1", "declined")));
        assertEquals(PaymentStatus.PENDING, lifecycle.getPayment(payment.getId()).getStatus());
    }

    @Test
    @DisplayName("Failed settlement moves PROCESSING to FAILED and notifies")
    void testSettleFailed() {
        Payment payment = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);
        lifecycle.submit(payment.getId());

        SettlementResult result = lifecycle.settle(payment.getId(), GatewaySettlement.failed("tx9", "insufficient funds"));

        assertEquals(PaymentStatus.FAILED, result.getPayment().getStatus());
        assertEquals("insufficient funds", result.getPayment().getFailureReason());
        assertEquals(1, harness.notifications.ofType(NotificationType.PAYMENT_FAILED).size());
    }

    @Test
    @DisplayName("A transaction id already attached to another payment is rejected")
    void testDuplicateTransactionId() {
        Payment first = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);
        Payment second = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);
        lifecycle.settle(first.getId(), GatewaySettlement.captured("tx1"));

        assertThrows(DuplicateTransactionException.class,
            () -> lifecycle.settle(second.getId(), GatewaySettlement.captured("tx1")));
        assertEquals(PaymentStatus.PENDING, lifecycle.getPayment(second.getId()).getStatus());
    }

    @Test
    @DisplayName("Cancelled payment is immune to later settlements")
    void testTerminalImmutability() {
        Payment payment = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);
        lifecycle.cancel(payment.getId());

        SettlementResult result = lifecycle.settle(payment.getId(), GatewaySettlement.captured("tx1"));

        assertFalse(result.isApplied());
        assertEquals(PaymentStatus.CANCELLED, result.getPayment().getStatus());
        assertNull(result.getPayment().getTransactionId());
        assertThrows(InvalidTransitionException.class, () -> lifecycle.cancel(payment.getId()));
    }

    @Test
    @DisplayName("Concurrent settlements of one payment apply exactly once")
    void testConcurrentSettlement() throws Exception {
        Payment payment = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);
        lifecycle.submit(payment.getId());

        int threadCount = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        try {
            List<Future<SettlementResult>> futures = new ArrayList<>();
            for (int i = 0; i < threadCount; i++) {
                futures.add(executor.submit(() -> {
                    startLatch.await();
                    return lifecycle.settle(payment.getId(), GatewaySettlement.captured("tx1"));
                }));
            }
            startLatch.countDown();

            int applied = 0;
            for (Future<SettlementResult> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).isApplied()) {
                    applied++;
                }
            }
            assertEquals(1, applied);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, harness.notifications.ofType(NotificationType.PAYMENT_COMPLETED).size());
    }

    @Test
    @DisplayName("Gateway references resolve by order id, transaction id, then payment id")
    void testFindByGatewayReference() {
        Payment payment = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);
        Payment processing = lifecycle.submit(payment.getId());

        assertEquals(payment.getId(),
            lifecycle.findByGatewayReference(processing.getGatewayOrderId(), null, null).orElseThrow().getId());
        assertEquals(payment.getId(),
            lifecycle.findByGatewayReference("order_unknown", null, payment.getId()).orElseThrow().getId());
        assertTrue(lifecycle.findByGatewayReference("order_unknown", "tx_unknown", UUID.randomUUID()).isEmpty());
    }

    @Test
    @DisplayName("History filters by card and status")
    void testHistory() {
        Payment done = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);
        lifecycle.settle(done.getId(), GatewaySettlement.captured("tx1"));
        Payment cancelled = lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);
        lifecycle.cancel(cancelled.getId());
        lifecycle.createImmediate(card.getId(), PaymentPreference.MINIMUM_DUE, null, null);

        assertEquals(3, lifecycle.history(card.getId(), null).size());
        List<Payment> completed = lifecycle.history(null, EnumSet.of(PaymentStatus.COMPLETED));
        assertEquals(1, completed.size());
        assertEquals(done.getId(), completed.get(0).getId());
        assertEquals(1, lifecycle.listInFlight().size());
    }

    @Test
    @DisplayName("Unknown payment id is reported as not found")
    void testPaymentNotFound() {
        assertThrows(PaymentNotFoundException.class, () -> lifecycle.getPayment(UUID.randomUUID()));
        assertThrows(PaymentNotFoundException.class, () -> lifecycle.submit(UUID.randomUUID()));
    }
}
