package org.procsim.node.resources;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.procsim.node.api.resources.IMonitorable;
import org.procsim.node.api.resources.IResource;
import org.procsim.node.api.resources.OperationalError;
import org.procsim.node.utils.monitoring.OperationalErrorLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Base class for node resources: holds the resource name and options and provides
 * error tracking and metrics in the same way for every resource.
 * <p>
 * Subclasses add their own metrics through {@link #addCustomMetrics(Map)}.
 */
public abstract class AbstractResource implements IResource, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String name;
    protected final Config options;
    private final OperationalErrorLog errors;

    protected AbstractResource(String name, Config options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource name must not be blank");
        }
        this.name = name;
        this.options = options;
        this.errors = new OperationalErrorLog(options.hasPath("maxErrors") ? options.getInt("maxErrors") : 1000);
    }

    @Override
    public String getResourceName() {
        return name;
    }

    /**
     * Records a transient error. The resource keeps operating; callers decide whether
     * the failure is propagated.
     */
    protected void recordError(String code, String message, String details) {
        errors.record(code, message, details);
    }

    @Override
    public List<OperationalError> getErrors() {
        return errors.snapshot();
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for subclasses to add resource-specific metrics. Call super first.
     *
     * @param metrics mutable map that already contains the base metrics.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
