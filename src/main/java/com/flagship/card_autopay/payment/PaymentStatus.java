package com.flagship.card_autopay.payment;

/**
 * Payment lifecycle states.
 *
 * <pre>
 * SCHEDULED --fire--> PENDING --submit--> PROCESSING --captured--> COMPLETED
 *     |                  |  \                 \--failed--> FAILED
 *     |                  |   \--captured (webhook before submit)--> COMPLETED
 *     \--cancel--> CANCELLED <--cancel--/
 * </pre>
 *
 * COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum PaymentStatus {
    /** A future intent; only surfaces in upcoming-payment views. */
    SCHEDULED,
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(PaymentStatus target) {
        return switch (this) {
            case SCHEDULED -> target == PENDING || target == CANCELLED;
            case PENDING -> target == PROCESSING || target == COMPLETED || target == CANCELLED;
            case PROCESSING -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
