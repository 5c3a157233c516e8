package org.procsim.runtime.api;

import java.time.Clock;
import java.util.Objects;

import org.procsim.runtime.internal.services.JavaRandomProvider;
import org.procsim.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Collaborators shared by all simulators of a node.
 *
 * @param clock          wall clock used for time-of-day dependent models.
 * @param randomProvider source of jitter.
 * @param tickIntervalMs period between ticks in milliseconds.
 * @param autoStart      whether simulators start ticking as soon as they are constructed.
 */
public record SimulationContext(Clock clock, IRandomProvider randomProvider, long tickIntervalMs, boolean autoStart) {

    public static final long DEFAULT_TICK_INTERVAL_MS = 1000L;

    public SimulationContext {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(randomProvider, "randomProvider");
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException("tickIntervalMs must be positive: " + tickIntervalMs);
        }
    }

    /**
     * Context with the system clock, unseeded randomness, 1 s ticks and auto-start.
     */
    public static SimulationContext defaults() {
        return new SimulationContext(Clock.systemDefaultZone(), new JavaRandomProvider(), DEFAULT_TICK_INTERVAL_MS, true);
    }

    /**
     * Builds a context from the {@code simulation} configuration section.
     * <ul>
     *   <li><b>tickIntervalMs</b>: tick period (default: 1000).</li>
     *   <li><b>autoStart</b>: start simulators on creation (default: true).</li>
     *   <li><b>seed</b>: optional seed for reproducible jitter within one run.</li>
     * </ul>
     */
    public static SimulationContext fromConfig(Config options) {
        long interval = options.hasPath("tickIntervalMs") ? options.getLong("tickIntervalMs") : DEFAULT_TICK_INTERVAL_MS;
        boolean autoStart = !options.hasPath("autoStart") || options.getBoolean("autoStart");
        IRandomProvider random = options.hasPath("seed")
                ? new JavaRandomProvider(options.getLong("seed"))
                : new JavaRandomProvider();
        return new SimulationContext(Clock.systemDefaultZone(), random, interval, autoStart);
    }

    public SimulationContext withAutoStart(boolean value) {
        return new SimulationContext(clock, randomProvider, tickIntervalMs, value);
    }
}
