package com.flagship.card_autopay.schedule;

import com.flagship.card_autopay.common.exception.StateConflictException;

import java.time.Instant;
import java.util.UUID;

public class ScheduleNotDueException extends StateConflictException {

    public ScheduleNotDueException(UUID scheduleId, Instant scheduledDate, Instant now) {
        super("SCHEDULE_NOT_DUE", String.format(
            "Schedule %s fires at %s, cannot fire at %s", scheduleId, scheduledDate, now));
    }
}
