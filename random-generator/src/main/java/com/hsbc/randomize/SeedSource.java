package com.hsbc.randomize;

/**
 * Supplies seeds for generators which are constructed without an explicit one.
 */
@FunctionalInterface
public interface SeedSource {

    /**
     * Produces a new seed. Every 32-bit value is a valid seed.
     *
     * @return a seed
     */
    int nextSeed();
}
