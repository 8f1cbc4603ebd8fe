package com.flagship.card_autopay.schedule;

import com.flagship.card_autopay.common.exception.ResourceNotFoundException;

import java.util.UUID;

public class ScheduleNotFoundException extends ResourceNotFoundException {

    public ScheduleNotFoundException(UUID scheduleId) {
        super("SCHEDULE_NOT_FOUND", "Scheduled payment not found: " + scheduleId);
    }
}
