package com.hsbc.randomize;

import java.util.UUID;

/**
 * A {@link SeedSource} which mixes ambient entropy from the running system: the monotonic clock,
 * a random UUID, the calling thread and the current process.
 *
 * <p>The result is not suitable for any security-sensitive purpose.
 */
public final class SystemSeedSource implements SeedSource {

    /** Shared instance; the source holds no state. */
    public static final SystemSeedSource INSTANCE = new SystemSeedSource();

    private static final int FACTOR = 19;

    private SystemSeedSource() {
    }

    @Override
    public int nextSeed() {
        UUID uuid = UUID.randomUUID();
        int seed = FACTOR * 1777771 + (int) System.nanoTime();
        seed = FACTOR * seed + (int) uuid.getMostSignificantBits();
        seed = FACTOR * seed + (int) uuid.getLeastSignificantBits();
        seed = FACTOR * seed + (int) Thread.currentThread().getId();
        return FACTOR * seed + (int) ProcessHandle.current().pid();
    }
}
