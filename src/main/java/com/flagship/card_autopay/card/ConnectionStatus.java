package com.flagship.card_autopay.card;

/**
 * Bank connection state of a card.
 *
 * <pre>
 * DISCONNECTED --sync--> SYNCING --ok--> CONNECTED --sync--> SYNCING
 *                           \--fail--> ERROR --sync--> SYNCING
 * </pre>
 */
public enum ConnectionStatus {
    DISCONNECTED,
    CONNECTED,
    SYNCING,
    ERROR;

    public boolean canTransitionTo(ConnectionStatus target) {
        return switch (this) {
            case DISCONNECTED, CONNECTED, ERROR -> target == SYNCING;
            case SYNCING -> target == CONNECTED || target == ERROR;
        };
    }
}
