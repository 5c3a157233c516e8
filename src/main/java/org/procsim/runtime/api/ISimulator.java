package org.procsim.runtime.api;

/**
 * A simulated device instance that advances its state on periodic ticks.
 * <p>
 * Implementations must provide a public constructor with the signature
 * {@code (String id, com.typesafe.config.Config options, SimulationContext context)}
 * so the instance registry can create them from a class tag and construction arguments.
 */
public interface ISimulator {

    /**
     * Returns the instance id assigned at creation.
     */
    String getId();

    /**
     * Starts ticking. Has no effect if already running.
     *
     * @return always {@code true}.
     */
    boolean start();

    /**
     * Stops ticking. Has no effect if already stopped. Simulated state is kept.
     *
     * @return always {@code true}.
     */
    boolean stop();

    boolean isRunning();

    /**
     * Advances the simulation by exactly one tick. A tick is applied completely or not at all.
     */
    void tick();
}
