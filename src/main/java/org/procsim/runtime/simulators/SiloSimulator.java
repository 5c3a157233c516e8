package org.procsim.runtime.simulators;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.DoubleConsumer;

import org.procsim.runtime.api.SimulationContext;
import org.procsim.runtime.api.Subscription;

import com.typesafe.config.Config;

/**
 * Simulates a silo level sensor that empties steadily and refills automatically.
 * <p>
 * While emptying, the level drops by {@code stepDown} per tick until it reaches 10 % of the
 * capacity; then the silo refills by {@code stepUp} per tick until it is full again.
 * Refilling takes a tenth of the emptying time. The emptying duration varies by ±10 %
 * and is drawn anew at the start of every emptying phase.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>capacity</b>: maximum fill level (default: 100).</li>
 *   <li><b>timeToEmpty</b>: approximate seconds from full to empty (default: 60).</li>
 * </ul>
 */
public class SiloSimulator extends AbstractSimulator {

    static final double LOW_LEVEL_FRACTION = 0.1;
    static final double EMPTYING_VARIANCE = 0.1;

    private final double capacity;
    private final double baseTimeToEmptyMs;
    private final double stepUp;
    private final List<DoubleConsumer> levelUpdateListeners = new CopyOnWriteArrayList<>();

    private double level;
    private double stepDown;
    private SiloMode mode = SiloMode.EMPTYING;

    public SiloSimulator(String id, Config options, SimulationContext context) {
        super(id, options, context);
        this.capacity = options.hasPath("capacity") ? options.getDouble("capacity") : 100.0;
        double timeToEmpty = options.hasPath("timeToEmpty") ? options.getDouble("timeToEmpty") : 60.0;
        if (!(capacity > 0) || Double.isInfinite(capacity)) {
            throw new IllegalArgumentException("capacity must be a positive number: " + capacity);
        }
        if (!(timeToEmpty > 0) || Double.isInfinite(timeToEmpty)) {
            throw new IllegalArgumentException("timeToEmpty must be a positive number: " + timeToEmpty);
        }
        this.baseTimeToEmptyMs = timeToEmpty * 1000;
        double timeToRefillMs = baseTimeToEmptyMs / 10;
        this.stepUp = capacity / (timeToRefillMs / context.tickIntervalMs());
        this.level = capacity;
        this.stepDown = randomEmptyingStep();
        autoStart();
    }

    @Override
    protected void onTick() {
        if (mode == SiloMode.EMPTYING) {
            level -= stepDown;
            if (level <= capacity * LOW_LEVEL_FRACTION) {
                mode = SiloMode.REFILLING;
                level = Math.max(0, level);
            }
        } else {
            level += stepUp;
            if (level >= capacity) {
                mode = SiloMode.EMPTYING;
                level = capacity;
                stepDown = randomEmptyingStep();
            }
        }
    }

    @Override
    protected void afterTick() {
        double rounded = getLevel();
        for (DoubleConsumer listener : levelUpdateListeners) {
            try {
                listener.accept(rounded);
            } catch (RuntimeException e) {
                log.warn("Level listener of silo '{}' failed: {}", id, e.getMessage());
                log.debug("Exception details:", e);
            }
        }
    }

    private double randomEmptyingStep() {
        double randomFactor = 1 + context.randomProvider().uniform(-EMPTYING_VARIANCE, EMPTYING_VARIANCE);
        double adjustedTimeToEmptyMs = baseTimeToEmptyMs * randomFactor;
        return capacity / (adjustedTimeToEmptyMs / context.tickIntervalMs());
    }

    /**
     * Returns the current fill level rounded to two decimal places.
     */
    public double getLevel() {
        synchronized (stateLock) {
            return Math.round(level * 100.0) / 100.0;
        }
    }

    /**
     * Registers a listener that receives the rounded level after every tick.
     *
     * @return subscription that removes the listener when cancelled.
     */
    public Subscription onLevelUpdate(DoubleConsumer listener) {
        levelUpdateListeners.add(listener);
        return () -> levelUpdateListeners.remove(listener);
    }

    public SiloMode getMode() {
        synchronized (stateLock) {
            return mode;
        }
    }

    public double getCapacity() {
        return capacity;
    }

    public double getStepUp() {
        return stepUp;
    }

    public double getStepDown() {
        synchronized (stateLock) {
            return stepDown;
        }
    }

    @Override
    protected void logStarted() {
        log.info("Silo simulator '{}' started (capacity={}, timeToEmpty={} s)", id, capacity, baseTimeToEmptyMs / 1000);
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("level", getLevel());
        metrics.put("listeners", levelUpdateListeners.size());
    }
}
