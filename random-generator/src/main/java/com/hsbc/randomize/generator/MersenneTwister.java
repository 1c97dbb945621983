package com.hsbc.randomize.generator;

import com.hsbc.randomize.SeedSource;
import com.hsbc.randomize.SystemSeedSource;
import java.util.Objects;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A Mersenne Twister (MT19937) word generator with period 2<sup>19937</sup>-1.
 *
 * <h2>Algorithm</h2>
 * The generator keeps a state block of {@value #N} words. Words are served from the block in
 * order, each passed through a tempering transform before it is released. Once every word of
 * the block has been served, the whole block is regenerated in place (each word mixed with its
 * neighbour and with the word {@value #M} positions ahead, wrapping around the block) before
 * the next word is served.
 *
 * <h2>Thread safety</h2>
 * A single instance may be shared between threads. Serving a word (including regeneration of
 * the block) and resetting the seed each hold the instance monitor for the state mutation only;
 * tempering is performed after the monitor is released.
 */
public final class MersenneTwister implements BitGenerator {

    private static final Logger log = LoggerFactory.getLogger(MersenneTwister.class);

    private static final int N = 624;
    private static final int M = 397;
    private static final int MATRIX_A = 0x9908b0df;
    private static final int UPPER_MASK = 0x80000000;
    private static final int LOWER_MASK = 0x7fffffff;
    private static final int[] MAG01 = {0x0, MATRIX_A};

    private final Object lock = new Object();
    private final int[] mt = new int[N];
    private int mti;
    private int seed;

    /**
     * Creates a generator with the given seed.
     *
     * @param seed the initial seed
     */
    public MersenneTwister(int seed) {
        reset(seed);
    }

    /**
     * Creates a generator seeded from the given source.
     *
     * @param seedSource source of the initial seed
     */
    public MersenneTwister(@Nonnull SeedSource seedSource) {
        this(Objects.requireNonNull(seedSource, "seedSource").nextSeed());
    }

    /**
     * Creates a generator seeded from ambient system entropy.
     */
    public MersenneTwister() {
        this(SystemSeedSource.INSTANCE);
    }

    @Override
    public int getSeed() {
        synchronized (lock) {
            return seed;
        }
    }

    @Override
    public int nextWord() {
        int y;
        synchronized (lock) {
            if (mti >= N) {
                regenerate();
            }
            y = mt[mti++];
        }

        y ^= y >>> 11;
        y ^= (y << 7) & 0x9d2c5680;
        y ^= (y << 15) & 0xefc60000;
        return y ^ (y >>> 18);
    }

    @Override
    public void reset() {
        synchronized (lock) {
            initialize(seed);
        }
    }

    @Override
    public void reset(int seed) {
        synchronized (lock) {
            initialize(seed);
        }
    }

    // Caller holds the lock.
    private void initialize(int newSeed) {
        seed = newSeed;
        mt[0] = newSeed;
        for (mti = 1; mti < N; mti++) {
            mt[mti] = 1812433253 * (mt[mti - 1] ^ (mt[mti - 1] >>> 30)) + mti;
        }
        log.debug("Mersenne Twister reset with seed {}", Integer.toUnsignedString(newSeed));
    }

    // Caller holds the lock.
    private void regenerate() {
        int kk;
        int y;
        for (kk = 0; kk < N - M; kk++) {
            y = (mt[kk] & UPPER_MASK) | (mt[kk + 1] & LOWER_MASK);
            mt[kk] = mt[kk + M] ^ (y >>> 1) ^ MAG01[y & 0x1];
        }
        for (; kk < N - 1; kk++) {
            y = (mt[kk] & UPPER_MASK) | (mt[kk + 1] & LOWER_MASK);
            mt[kk] = mt[kk + (M - N)] ^ (y >>> 1) ^ MAG01[y & 0x1];
        }
        y = (mt[N - 1] & UPPER_MASK) | (mt[0] & LOWER_MASK);
        mt[N - 1] = mt[M - 1] ^ (y >>> 1) ^ MAG01[y & 0x1];

        mti = 0;
    }
}
