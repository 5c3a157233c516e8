package org.procsim.node.api.resources;

import java.util.List;
import java.util.Map;

/**
 * Implemented by components that expose health, metrics and operational errors.
 * <p>
 * Operational errors are transient failures that did not stop the component but may
 * have affected its output, e.g. a record that could not be written to the store.
 */
public interface IMonitorable {

    /**
     * Returns a snapshot of the component's metrics.
     *
     * @return map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns a snapshot of the recorded operational errors, oldest first.
     *
     * @return list of errors, never {@code null}.
     */
    List<OperationalError> getErrors();

    /**
     * Clears all recorded operational errors.
     */
    void clearErrors();

    /**
     * Returns whether the component is operating without recorded errors.
     *
     * @return {@code true} if healthy.
     */
    boolean isHealthy();
}
