package me.internalizable.sessionhub.servermanager.event;

/**
 * Handle returned when a listener is attached. Cancelling detaches the
 * listener; cancelling twice is a no-op.
 */
@FunctionalInterface
public interface Subscription {

    /**
     * Detach the listener.
     */
    void unsubscribe();
}
