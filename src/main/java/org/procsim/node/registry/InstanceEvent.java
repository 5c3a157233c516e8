package org.procsim.node.registry;

import java.util.List;

import org.procsim.runtime.api.ISimulator;

/**
 * Lifecycle notification emitted by the {@link InstanceRegistry}.
 *
 * @param id        instance id.
 * @param className class tag the instance was created with.
 * @param args      construction arguments the instance was created with.
 * @param instance  the live instance (already stopped for deletions).
 */
public record InstanceEvent(String id, String className, List<Object> args, ISimulator instance) {
}
