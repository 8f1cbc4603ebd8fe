package com.flagship.card_autopay.webhook;

import com.flagship.card_autopay.common.exception.BusinessRuleException;

public class MalformedWebhookException extends BusinessRuleException {

    public MalformedWebhookException(String message) {
        super("MALFORMED_WEBHOOK", message);
    }
}
