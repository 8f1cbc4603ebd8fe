package com.flagship.card_autopay.common.exception;

/**
 * A lifecycle command is not permitted from the entity's current state.
 */
public class InvalidTransitionException extends StateConflictException {

    public InvalidTransitionException(String message) {
        super("INVALID_TRANSITION", message);
    }

    public static InvalidTransitionException of(String entity, Object id, Enum<?> from, Enum<?> to) {
        return new InvalidTransitionException(
            String.format("Cannot move %s %s from %s to %s", entity, id, from, to));
    }
}
