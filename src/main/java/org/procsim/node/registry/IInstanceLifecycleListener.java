package org.procsim.node.registry;

/**
 * Receives creation and deletion notifications from the {@link InstanceRegistry}.
 * <p>
 * Callbacks run on the thread that created or deleted the instance and should return
 * quickly. Exceptions thrown by a listener are logged by the registry and never abort
 * the creation or deletion.
 */
public interface IInstanceLifecycleListener {

    default void onCreated(InstanceEvent event) {
    }

    default void onDeleted(InstanceEvent event) {
    }
}
