package org.procsim.runtime.clock;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded fixed-rate scheduler that drives one simulator.
 * <p>
 * Each driver owns one daemon thread, so consecutive ticks of the same simulator never
 * overlap. A tick that throws is logged and counted; it does not cancel the schedule.
 * <p>
 * {@link #start(Runnable)} and {@link #stop()} are idempotent and may be called from any thread.
 */
public class TickDriver {

    private static final Logger log = LoggerFactory.getLogger(TickDriver.class);

    private final String name;
    private final long intervalMs;
    private final AtomicLong failedTicks = new AtomicLong();
    private ScheduledExecutorService scheduler;

    /**
     * @param name       used for the thread name ({@code tick-<name>}).
     * @param intervalMs tick period in milliseconds, must be positive.
     */
    public TickDriver(String name, long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive: " + intervalMs);
        }
        this.name = name;
        this.intervalMs = intervalMs;
    }

    /**
     * Starts invoking {@code tick} every interval, first after one full interval.
     *
     * @return {@code true} if the driver was started, {@code false} if it was already running.
     */
    public synchronized boolean start(Runnable tick) {
        if (scheduler != null) {
            return false;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tick-" + name);
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(() -> runSafely(tick), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.debug("Tick driver '{}' started with interval {} ms", name, intervalMs);
        return true;
    }

    /**
     * Cancels future ticks. A tick that is currently executing is allowed to finish.
     *
     * @return {@code true} if the driver was stopped, {@code false} if it was not running.
     */
    public synchronized boolean stop() {
        if (scheduler == null) {
            return false;
        }
        scheduler.shutdown();
        scheduler = null;
        log.debug("Tick driver '{}' stopped", name);
        return true;
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public long getFailedTicks() {
        return failedTicks.get();
    }

    private void runSafely(Runnable tick) {
        try {
            tick.run();
        } catch (RuntimeException e) {
            failedTicks.incrementAndGet();
            log.warn("Tick of '{}' failed: {}", name, e.getMessage());
            log.debug("Exception details:", e);
        }
    }
}
