package com.flagship.card_autopay.common.exception;

/**
 * Raised when the single-writer lock for an entity could not be acquired in time.
 */
public class EntityBusyException extends StateConflictException {

    public EntityBusyException(String lockKey) {
        super("ENTITY_BUSY", "Entity " + lockKey + " is being modified by another operation, retry later");
    }
}
