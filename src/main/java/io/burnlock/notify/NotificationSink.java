package io.burnlock.notify;

import io.burnlock.model.BurnNotification;

/**
 * Outbound channel to connected clients. Delivery is best-effort; the engine never depends on
 * a notification reaching anyone, and clients must reconcile against storage after reconnecting.
 */
@FunctionalInterface
public interface NotificationSink {

    void messageBurned(BurnNotification notification);
}
