package org.procsim.runtime.api;

/**
 * Handle returned when registering a listener; cancelling it removes the listener.
 * Cancelling more than once has no effect.
 */
@FunctionalInterface
public interface Subscription {

    void cancel();
}
