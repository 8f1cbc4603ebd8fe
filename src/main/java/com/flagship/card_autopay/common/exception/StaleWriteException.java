package com.flagship.card_autopay.common.exception;

/**
 * A write was based on a version of the entity that is no longer current.
 */
public class StaleWriteException extends StateConflictException {

    public StaleWriteException(String entity, Object id, Long expectedVersion, Long actualVersion) {
        super("STALE_WRITE", String.format(
            "%s %s was modified concurrently (expected version %s, found %s)",
            entity, id, expectedVersion, actualVersion));
    }
}
