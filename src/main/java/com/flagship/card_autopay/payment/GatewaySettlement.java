package com.flagship.card_autopay.payment;

import lombok.Value;

/**
 * Final outcome of a payment as reported by the gateway.
 */
@Value
public class GatewaySettlement {

    public enum Outcome {
        CAPTURED,
        FAILED
    }

    Outcome outcome;
    String transactionId;
    String failureReason;

    public static GatewaySettlement captured(String transactionId) {
        return new GatewaySettlement(Outcome.CAPTURED, transactionId, null);
    }

    public static GatewaySettlement failed(String transactionId, String failureReason) {
        return new GatewaySettlement(Outcome.FAILED, transactionId, failureReason);
    }
}
