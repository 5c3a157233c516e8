package org.procsim.runtime.api;

import java.util.function.Consumer;

/**
 * Implemented by simulators whose construction arguments can change at runtime.
 * <p>
 * Every update carries the complete new construction payload, so that recreating the
 * instance from the last update yields an equivalent instance.
 */
public interface IUpdateNotifier {

    /**
     * Registers a listener for update events.
     *
     * @param listener receives the new construction payload.
     * @return subscription that removes the listener when cancelled.
     */
    Subscription onUpdate(Consumer<Object> listener);
}
