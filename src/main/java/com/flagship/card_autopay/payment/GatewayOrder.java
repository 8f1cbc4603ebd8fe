package com.flagship.card_autopay.payment;

import lombok.Value;

/**
 * Gateway acknowledgement of a submitted payment. The order id is what webhooks refer back to.
 */
@Value
public class GatewayOrder {
    String orderId;
}
