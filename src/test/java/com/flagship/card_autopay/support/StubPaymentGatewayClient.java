package com.flagship.card_autopay.support;

import com.flagship.card_autopay.common.exception.ExternalCallException;
import com.flagship.card_autopay.payment.GatewayOrder;
import com.flagship.card_autopay.payment.PaymentGatewayClient;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class StubPaymentGatewayClient implements PaymentGatewayClient {

    public enum Mode { ACCEPT, UNREACHABLE, SLOW }

    private volatile Mode mode = Mode.ACCEPT;
    private volatile long slowMillis = 2_000;
    private final AtomicInteger sequence = new AtomicInteger();
    private final Map<UUID, String> orders = new ConcurrentHashMap<>();

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public void setSlowMillis(long slowMillis) {
        this.slowMillis = slowMillis;
    }

    public int callCount() {
        return sequence.get();
    }

    public String orderFor(UUID paymentId) {
        return orders.get(paymentId);
    }

    @Override
    public GatewayOrder submitPayment(UUID paymentId, UUID cardId, BigDecimal amount) {
        int n = sequence.incrementAndGet();
        switch (mode) {
            case UNREACHABLE -> throw new ExternalCallException("Gateway unreachable");
            case SLOW -> {
                try {
                    Thread.sleep(slowMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            case ACCEPT -> {
            }
        }
        String orderId = "order_" + n;
        orders.put(paymentId, orderId);
        return new GatewayOrder(orderId);
    }
}
