package com.flagship.card_autopay.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Accepts every order and hands back a synthetic order id. Settlement has to be driven by
 * posting a webhook.
 */
@Component
@ConditionalOnProperty(name = "autopay.simulation.gateway.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SimulatedPaymentGatewayClient implements PaymentGatewayClient {

    @Override
    public GatewayOrder submitPayment(UUID paymentId, UUID cardId, BigDecimal amount) {
        String orderId = "order_" + UUID.randomUUID().toString().replace("-", "").substring(0, 14);
        log.info("Simulated gateway accepted payment {} for {} as {}", paymentId, amount, orderId);
        return new GatewayOrder(orderId);
    }
}
