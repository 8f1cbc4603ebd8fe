package com.flagship.card_autopay.notification;

/**
 * Fire-and-forget sink for lifecycle notifications.
 *
 * Implementations must not throw: a notification that cannot be queued is logged and
 * dropped, and the caller's state change stands.
 */
public interface NotificationDispatcher {

    void dispatch(LifecycleNotification notification);
}
