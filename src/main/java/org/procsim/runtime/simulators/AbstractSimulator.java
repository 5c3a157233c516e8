package org.procsim.runtime.simulators;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.procsim.node.api.resources.IMonitorable;
import org.procsim.node.api.resources.OperationalError;
import org.procsim.node.utils.monitoring.OperationalErrorLog;
import org.procsim.runtime.api.ISimulator;
import org.procsim.runtime.api.SimulationContext;
import org.procsim.runtime.clock.TickDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Base class for simulators: owns the tick driver, serializes ticks against readers and
 * tracks tick failures.
 * <p>
 * Subclasses implement {@link #onTick()}, which always runs while holding {@link #stateLock}.
 * Accessors of simulated state must synchronize on the same lock so callers never observe
 * a partially applied tick. Subclass constructors call {@link #autoStart()} as their last
 * statement.
 */
public abstract class AbstractSimulator implements ISimulator, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String id;
    protected final Config options;
    protected final SimulationContext context;
    protected final Object stateLock = new Object();

    private final TickDriver tickDriver;
    private final AtomicLong ticksProcessed = new AtomicLong();
    private final OperationalErrorLog errors = new OperationalErrorLog(100);

    protected AbstractSimulator(String id, Config options, SimulationContext context) {
        this.id = id;
        this.options = options;
        this.context = context;
        this.tickDriver = new TickDriver(id, context.tickIntervalMs());
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public final boolean start() {
        if (tickDriver.start(this::tick)) {
            logStarted();
        }
        return true;
    }

    @Override
    public final boolean stop() {
        if (tickDriver.stop()) {
            log.info("{} '{}' stopped", getClass().getSimpleName(), id);
        }
        return true;
    }

    @Override
    public boolean isRunning() {
        return tickDriver.isRunning();
    }

    @Override
    public final void tick() {
        try {
            synchronized (stateLock) {
                onTick();
            }
            ticksProcessed.incrementAndGet();
            afterTick();
        } catch (RuntimeException e) {
            log.warn("{} '{}' tick failed: {}", getClass().getSimpleName(), id, e.getMessage());
            log.debug("Exception details:", e);
            errors.record("TICK_FAILED", "Tick failed", "Instance: " + id + ", cause: " + e.getMessage());
        }
    }

    /**
     * Advances the simulated state by one tick. Called with {@link #stateLock} held.
     */
    protected abstract void onTick();

    /**
     * Called after a successful tick without the state lock held, e.g. to notify listeners.
     */
    protected void afterTick() {
        // Default: nothing to notify
    }

    /**
     * Template method for logging simulator startup.
     */
    protected void logStarted() {
        log.info("{} '{}' started", getClass().getSimpleName(), id);
    }

    protected final void autoStart() {
        if (context.autoStart()) {
            start();
        }
    }

    public long getTicksProcessed() {
        return ticksProcessed.get();
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
        metrics.put("ticks_processed", ticksProcessed.get());
        addCustomMetrics(metrics);
        return metrics;
    }

    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
