package com.hsbc.randomize.generator;

/**
 * A deterministic source of raw 32-bit words.
 *
 * <p>Implementations must reproduce the identical sequence of words for an identical seed and
 * call sequence, across instances and process restarts. Every 32-bit value is a valid seed.
 */
public interface BitGenerator {

    /**
     * Gets the seed from which the current sequence was derived.
     *
     * @return the seed
     */
    int getSeed();

    /**
     * Produces the next word of the sequence.
     *
     * @return the next word, to be interpreted as an unsigned 32-bit value
     */
    int nextWord();

    /**
     * Restarts the sequence from the current seed.
     */
    void reset();

    /**
     * Restarts the sequence from the given seed.
     *
     * @param seed the new seed
     */
    void reset(int seed);
}
