package org.procsim.runtime.spi;

/**
 * Source of randomness for simulators.
 * <p>
 * Simulators never call {@link Math#random()} directly; they draw from an injected
 * provider so tests can supply fixed values and check clamping and accumulation exactly.
 */
@FunctionalInterface
public interface IRandomProvider {

    /**
     * Returns the next uniformly distributed value in {@code [0.0, 1.0)}.
     */
    double nextDouble();

    /**
     * Returns a uniformly distributed value in {@code [min, max)}.
     */
    default double uniform(double min, double max) {
        return min + nextDouble() * (max - min);
    }
}
