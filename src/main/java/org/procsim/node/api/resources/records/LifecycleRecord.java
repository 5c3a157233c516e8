package org.procsim.node.api.resources.records;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The durable description of a simulated instance: everything needed to recreate it.
 * <p>
 * {@code args} is the opaque construction payload. Its elements are JSON-compatible
 * values (maps, lists, strings, numbers, booleans, {@code null}).
 *
 * @param id        unique instance identifier, used as the storage key.
 * @param className simulation type tag, e.g. {@code "SiloSimulator"}; records are grouped by it.
 * @param args      construction arguments, never {@code null}.
 */
public record LifecycleRecord(String id, String className, List<Object> args) {

    public LifecycleRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(className, "className");
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    /**
     * Returns a copy of this record with its arguments replaced.
     */
    public LifecycleRecord withArgs(List<Object> newArgs) {
        return new LifecycleRecord(id, className, newArgs);
    }
}
