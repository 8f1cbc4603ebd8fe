package com.flagship.card_autopay.payment;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outbound port to the payment gateway.
 *
 * Implementations throw {@link com.flagship.card_autopay.common.exception.ExternalCallException}
 * when the gateway is unreachable or rejects the order. The final outcome of an accepted order
 * arrives later by webhook.
 */
public interface PaymentGatewayClient {

    GatewayOrder submitPayment(UUID paymentId, UUID cardId, BigDecimal amount);
}
