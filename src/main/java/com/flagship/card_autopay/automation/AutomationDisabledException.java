package com.flagship.card_autopay.automation;

import com.flagship.card_autopay.common.exception.BusinessRuleException;

import java.util.UUID;

public class AutomationDisabledException extends BusinessRuleException {

    public AutomationDisabledException(UUID cardId) {
        super("AUTOMATION_DISABLED", "Automation is disabled for card " + cardId);
    }
}
