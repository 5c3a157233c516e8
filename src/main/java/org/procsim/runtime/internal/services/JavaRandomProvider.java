package org.procsim.runtime.internal.services;

import java.util.Random;

import org.procsim.runtime.spi.IRandomProvider;

/**
 * {@link IRandomProvider} backed by {@link java.util.Random}. Thread-safe.
 */
public class JavaRandomProvider implements IRandomProvider {

    private final Random random;

    public JavaRandomProvider() {
        this.random = new Random();
    }

    public JavaRandomProvider(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }
}
