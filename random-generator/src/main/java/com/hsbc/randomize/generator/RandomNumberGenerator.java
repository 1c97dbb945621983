package com.hsbc.randomize.generator;

import com.hsbc.randomize.ErrorMessages;
import com.hsbc.randomize.InvalidFloatingRangeResult;
import com.hsbc.randomize.InvalidIntegralRangeResult;
import com.hsbc.randomize.RandomizeOptions;
import java.math.BigDecimal;
import java.util.Objects;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A pseudo-random number generator which derives booleans, bytes, bounded integers and bounded
 * floating-point values from the raw words of a {@link BitGenerator}.
 *
 * <p>All bounded values are scaled from {@link #nextDouble()}, so every derived value consumes a
 * fixed, predictable number of words and a generator reset to the same seed reproduces the same
 * values for the same sequence of calls.
 *
 * <h2>Inverted ranges</h2>
 * When an operation is given a minimum greater than its maximum, the outcome is determined by the
 * {@link RandomizeOptions} supplied at construction: {@link RandomizeOptions#getInvalidFloatingRangeResult()}
 * for {@code double} operations and {@link RandomizeOptions#getInvalidIntegralRangeResult()} for
 * integral and {@link BigDecimal} operations.
 *
 * <h2>Unsigned values</h2>
 * Unsigned 32-bit values are carried in a {@code long} whose value lies in
 * {@code [0, }{@link #UINT_MAX_VALUE}{@code ]}. Unsigned arguments outside that range are rejected.
 *
 * <h2>Thread safety</h2>
 * An instance may be shared between threads. The underlying word generator guards its own state,
 * and the bit cache used by {@link #nextBool()} is guarded by a separate monitor.
 */
public class RandomNumberGenerator {

    private static final Logger log = LoggerFactory.getLogger(RandomNumberGenerator.class);

    /** The largest unsigned 32-bit value. */
    public static final long UINT_MAX_VALUE = 0xFFFFFFFFL;

    private static final double INT_TO_DOUBLE_MULTIPLIER = 1.0 / (Integer.MAX_VALUE + 1.0);
    private static final BigDecimal INT_TO_DECIMAL_DIVISOR = BigDecimal.valueOf(Integer.MAX_VALUE + 1L);
    private static final double UINT_RANGE = UINT_MAX_VALUE + 1.0;

    private final BitGenerator generator;
    private final RandomizeOptions options;

    private final Object bitLock = new Object();
    private int bitBuffer;
    private int bitCount;

    /**
     * Creates a generator with the given seed and default options.
     *
     * @param seed the initial seed
     */
    public RandomNumberGenerator(int seed) {
        this(seed, RandomizeOptions.DEFAULT);
    }

    /**
     * Creates a generator with the given seed and options.
     *
     * @param seed the initial seed
     * @param options range policies consulted by bounded operations
     */
    public RandomNumberGenerator(int seed, @Nonnull RandomizeOptions options) {
        this(new MersenneTwister(seed), options);
    }

    /**
     * Creates a generator seeded from ambient system entropy, with default options.
     */
    public RandomNumberGenerator() {
        this(RandomizeOptions.DEFAULT);
    }

    /**
     * Creates a generator seeded from ambient system entropy.
     *
     * @param options range policies consulted by bounded operations
     */
    public RandomNumberGenerator(@Nonnull RandomizeOptions options) {
        this(new MersenneTwister(), options);
    }

    /**
     * Creates a generator over an existing word source, mainly for testing purposes.
     *
     * @param generator the word source
     * @param options range policies consulted by bounded operations
     */
    public RandomNumberGenerator(@Nonnull BitGenerator generator, @Nonnull RandomizeOptions options) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.options = Objects.requireNonNull(options, "options");
    }

    public RandomizeOptions getOptions() {
        return options;
    }

    public int getSeed() {
        return generator.getSeed();
    }

    /**
     * Gets a random, nonnegative integer less than {@link Integer#MAX_VALUE}.
     *
     * @return a value in {@code [0, Integer.MAX_VALUE)}
     */
    public int next() {
        int result;
        do {
            result = nextInclusive();
        } while (result == Integer.MAX_VALUE);
        return result;
    }

    /**
     * Gets a random integer between zero and {@code maxValue}.
     *
     * @param maxValue the exclusive maximum; if negative, it is an exclusive minimum instead and
     *                 zero becomes the inclusive maximum
     * @return a value in {@code [0, maxValue)}, or {@code (maxValue, 0]} for a negative bound
     */
    public int next(int maxValue) {
        return (int) (nextDouble() * maxValue);
    }

    /**
     * Gets a random integer greater than or equal to {@code minValue} and less than
     * {@code maxValue}. Equal bounds yield {@code minValue}.
     *
     * @param minValue the inclusive minimum
     * @param maxValue the exclusive maximum
     * @return a value in {@code [minValue, maxValue)}
     * @throws IllegalArgumentException if the range is inverted and the integral policy is
     *                                  {@link InvalidIntegralRangeResult#EXCEPTION}
     */
    public int next(int minValue, int maxValue) {
        if (minValue > maxValue) {
            InvalidIntegralRangeResult policy = resolveIntegralPolicy(minValue, maxValue);
            switch (policy) {
                case MIN_BOUND:
                    return minValue;
                case ZERO:
                    return 0;
                case MAX_BOUND:
                    return maxValue;
                default:
                    int swap = minValue;
                    minValue = maxValue;
                    maxValue = swap;
                    break;
            }
        }
        return (int) (minValue + (long) (nextDouble() * ((double) maxValue - minValue)));
    }

    /**
     * Gets a random, nonnegative integer less than or equal to {@link Integer#MAX_VALUE}.
     *
     * @return a value in {@code [0, Integer.MAX_VALUE]}
     */
    public int nextInclusive() {
        return generator.nextWord() >>> 1;
    }

    /**
     * Gets a random integer between zero and {@code maxValue}, both inclusive.
     *
     * @param maxValue the inclusive maximum; if negative, it is the inclusive minimum instead
     * @return a value in {@code [0, maxValue]}, or {@code [maxValue, 0]} for a negative bound
     */
    public int nextInclusive(int maxValue) {
        if (maxValue == 0) {
            return 0;
        }
        if (maxValue == Integer.MAX_VALUE) {
            return (int) (nextDouble() * (Integer.MAX_VALUE + 1.0));
        }
        if (maxValue < 0) {
            return (int) (nextDouble() * (maxValue - 1.0));
        }
        return next(maxValue + 1);
    }

    /**
     * Gets a random integer greater than or equal to {@code minValue} and less than or equal to
     * {@code maxValue}.
     *
     * @param minValue the inclusive minimum
     * @param maxValue the inclusive maximum
     * @return a value in {@code [minValue, maxValue]}
     * @throws IllegalArgumentException if the range is inverted and the integral policy is
     *                                  {@link InvalidIntegralRangeResult#EXCEPTION}
     */
    public int nextInclusive(int minValue, int maxValue) {
        if (minValue > maxValue) {
            InvalidIntegralRangeResult policy = resolveIntegralPolicy(minValue, maxValue);
            switch (policy) {
                case MIN_BOUND:
                    return minValue;
                case ZERO:
                    return 0;
                case MAX_BOUND:
                    return maxValue;
                default:
                    int swap = minValue;
                    minValue = maxValue;
                    maxValue = swap;
                    break;
            }
        }
        if (maxValue < Integer.MAX_VALUE) {
            return next(minValue, maxValue + 1);
        }
        if (minValue > Integer.MIN_VALUE) {
            return next(minValue - 1, maxValue) + 1;
        }
        return (int) (Integer.MIN_VALUE + (long) (nextDouble() * UINT_RANGE));
    }

    /**
     * Gets a random unsigned integer less than {@link #UINT_MAX_VALUE}.
     *
     * @return a value in {@code [0, UINT_MAX_VALUE)}
     */
    public long nextUInt() {
        long result;
        do {
            result = nextUIntInclusive();
        } while (result == UINT_MAX_VALUE);
        return result;
    }

    /**
     * Gets a random unsigned integer less than {@code maxValue}.
     *
     * @param maxValue the exclusive maximum, in {@code [0, UINT_MAX_VALUE]}
     * @return a value in {@code [0, maxValue)}
     */
    public long nextUInt(long maxValue) {
        checkUnsigned(maxValue, "maxValue");
        return (long) (nextDouble() * maxValue);
    }

    /**
     * Gets a random unsigned integer greater than or equal to {@code minValue} and less than
     * {@code maxValue}.
     *
     * @param minValue the inclusive minimum, in {@code [0, UINT_MAX_VALUE]}
     * @param maxValue the exclusive maximum, in {@code [0, UINT_MAX_VALUE]}
     * @return a value in {@code [minValue, maxValue)}
     * @throws IllegalArgumentException if an argument is not an unsigned 32-bit value, or if the
     *                                  range is inverted and the integral policy is
     *                                  {@link InvalidIntegralRangeResult#EXCEPTION}
     */
    public long nextUInt(long minValue, long maxValue) {
        checkUnsigned(minValue, "minValue");
        checkUnsigned(maxValue, "maxValue");
        if (minValue > maxValue) {
            InvalidIntegralRangeResult policy = resolveIntegralPolicy(minValue, maxValue);
            switch (policy) {
                case MIN_BOUND:
                    return minValue;
                case ZERO:
                    return 0L;
                case MAX_BOUND:
                    return maxValue;
                default:
                    long swap = minValue;
                    minValue = maxValue;
                    maxValue = swap;
                    break;
            }
        }
        return minValue + (long) (nextDouble() * (maxValue - minValue));
    }

    /**
     * Gets a random unsigned integer less than or equal to {@link #UINT_MAX_VALUE}.
     *
     * @return a value in {@code [0, UINT_MAX_VALUE]}
     */
    public long nextUIntInclusive() {
        return Integer.toUnsignedLong(generator.nextWord());
    }

    /**
     * Gets a random unsigned integer less than or equal to {@code maxValue}.
     *
     * @param maxValue the inclusive maximum, in {@code [0, UINT_MAX_VALUE]}
     * @return a value in {@code [0, maxValue]}
     */
    public long nextUIntInclusive(long maxValue) {
        checkUnsigned(maxValue, "maxValue");
        if (maxValue == 0L) {
            return 0L;
        }
        if (maxValue == UINT_MAX_VALUE) {
            return (long) (nextDouble() * UINT_RANGE);
        }
        return nextUInt(maxValue + 1);
    }

    /**
     * Gets a random unsigned integer greater than or equal to {@code minValue} and less than or
     * equal to {@code maxValue}.
     *
     * @param minValue the inclusive minimum, in {@code [0, UINT_MAX_VALUE]}
     * @param maxValue the inclusive maximum, in {@code [0, UINT_MAX_VALUE]}
     * @return a value in {@code [minValue, maxValue]}
     */
    public long nextUIntInclusive(long minValue, long maxValue) {
        checkUnsigned(minValue, "minValue");
        checkUnsigned(maxValue, "maxValue");
        if (minValue > maxValue) {
            InvalidIntegralRangeResult policy = resolveIntegralPolicy(minValue, maxValue);
            switch (policy) {
                case MIN_BOUND:
                    return minValue;
                case ZERO:
                    return 0L;
                case MAX_BOUND:
                    return maxValue;
                default:
                    long swap = minValue;
                    minValue = maxValue;
                    maxValue = swap;
                    break;
            }
        }
        if (maxValue < UINT_MAX_VALUE) {
            return nextUInt(minValue, maxValue + 1);
        }
        if (minValue > 0L) {
            return nextUInt(minValue - 1, maxValue) + 1;
        }
        return nextUIntInclusive();
    }

    /**
     * Gets a random boolean value.
     *
     * <p>A single word supplies 32 consecutive results: the first result is its lowest bit, and
     * each of the following 31 calls shifts the cached word one bit further.
     *
     * @return a random boolean
     */
    public boolean nextBool() {
        synchronized (bitLock) {
            if (bitCount == 0) {
                bitBuffer = (int) nextUInt();
                bitCount = 31;
                return (bitBuffer & 0x1) == 1;
            }
            bitCount--;
            bitBuffer >>>= 1;
            return (bitBuffer & 0x1) == 1;
        }
    }

    /**
     * Fills the given buffer with random bytes.
     *
     * @param buffer the buffer to fill
     * @throws NullPointerException if {@code buffer} is {@code null}
     */
    public void nextBytes(byte[] buffer) {
        Objects.requireNonNull(buffer, ErrorMessages.NULL_BUFFER);
        nextBytes(buffer, 0, buffer.length);
    }

    /**
     * Fills a region of the given buffer with random bytes. Each word supplies four bytes, lowest
     * byte first; a trailing region of one to three bytes consumes one further word.
     *
     * @param buffer the buffer to fill
     * @param offset index of the first byte to fill
     * @param length number of bytes to fill
     * @throws NullPointerException if {@code buffer} is {@code null}
     * @throws IndexOutOfBoundsException if the region lies outside the buffer
     */
    public void nextBytes(byte[] buffer, int offset, int length) {
        Objects.requireNonNull(buffer, ErrorMessages.NULL_BUFFER);
        Objects.checkFromIndexSize(offset, length, buffer.length);
        int end = offset + length;
        int i = offset;
        while (i < end - 3) {
            long u = nextUInt();
            buffer[i++] = (byte) u;
            buffer[i++] = (byte) (u >>> 8);
            buffer[i++] = (byte) (u >>> 16);
            buffer[i++] = (byte) (u >>> 24);
        }
        if (i < end) {
            long u = nextUInt();
            for (int shift = 0; i < end; shift += 8) {
                buffer[i++] = (byte) (u >>> shift);
            }
        }
    }

    /**
     * Gets a random, nonnegative floating-point number less than 1.
     *
     * @return a value in {@code [0, 1)}
     */
    public double nextDouble() {
        return (generator.nextWord() >>> 1) * INT_TO_DOUBLE_MULTIPLIER;
    }

    /**
     * Gets a random floating-point number between zero and {@code maxValue}.
     *
     * @param maxValue the exclusive maximum; if negative, it is an exclusive minimum instead. NaN
     *                 yields NaN and an infinity is always returned as the result
     * @return a value in {@code [0, maxValue)}
     */
    public double nextDouble(double maxValue) {
        if (Double.isNaN(maxValue)) {
            return Double.NaN;
        }
        if (Double.isInfinite(maxValue)) {
            return maxValue;
        }
        return nextDouble() * maxValue;
    }

    /**
     * Gets a random floating-point number greater than or equal to {@code minValue} and less than
     * {@code maxValue}.
     *
     * <p>If either bound is NaN the result is NaN. An infinite bound is returned as the result,
     * unless both bounds are opposite infinities, in which case either infinity is returned at
     * random.
     *
     * @param minValue the inclusive minimum
     * @param maxValue the exclusive maximum
     * @return a value in {@code [minValue, maxValue)}
     * @throws IllegalArgumentException if the range is inverted and the floating policy is
     *                                  {@link InvalidFloatingRangeResult#EXCEPTION}
     */
    public double nextDouble(double minValue, double maxValue) {
        if (Double.isNaN(minValue) || Double.isNaN(maxValue)) {
            return Double.NaN;
        }
        if (minValue > maxValue) {
            InvalidFloatingRangeResult policy = options.getInvalidFloatingRangeResult();
            log.debug("Inverted range [{}, {}) resolved by policy {}", minValue, maxValue, policy);
            switch (policy) {
                case MIN_BOUND:
                    return minValue;
                case ZERO:
                    return 0.0;
                case MAX_BOUND:
                    return maxValue;
                case EXCEPTION:
                    throw new IllegalArgumentException(ErrorMessages.MIN_ABOVE_MAX);
                case NAN:
                    return Double.NaN;
                default:
                    double swap = minValue;
                    minValue = maxValue;
                    maxValue = swap;
                    break;
            }
        }

        if (Double.isInfinite(minValue)) {
            if (Double.isInfinite(maxValue) && Math.signum(minValue) != Math.signum(maxValue)) {
                return nextBool() ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
            }
            return minValue;
        }
        if (Double.isInfinite(maxValue)) {
            return maxValue;
        }
        double u = nextDouble();
        double width = maxValue - minValue;
        double value = Double.isInfinite(width)
            ? (u * maxValue) + ((1.0 - u) * minValue)
            : minValue + (u * width);
        return value < maxValue || minValue == maxValue ? value : Math.nextDown(maxValue);
    }

    /**
     * Gets a random, nonnegative decimal number less than 1. The result is the exact decimal
     * value of the number {@link #nextDouble()} would have produced from the same word.
     *
     * @return a value in {@code [0, 1)}
     */
    public BigDecimal nextDecimal() {
        return BigDecimal.valueOf(nextInclusive()).divide(INT_TO_DECIMAL_DIVISOR);
    }

    /**
     * Gets a random decimal number between zero and {@code maxValue}.
     *
     * @param maxValue the exclusive maximum; if negative, it is an exclusive minimum instead
     * @return a value in {@code [0, maxValue)}
     */
    public BigDecimal nextDecimal(@Nonnull BigDecimal maxValue) {
        Objects.requireNonNull(maxValue, "maxValue");
        return nextDecimal().multiply(maxValue);
    }

    /**
     * Gets a random decimal number greater than or equal to {@code minValue} and less than
     * {@code maxValue}. Inverted ranges follow the integral policy.
     *
     * @param minValue the inclusive minimum
     * @param maxValue the exclusive maximum
     * @return a value in {@code [minValue, maxValue)}
     * @throws IllegalArgumentException if the range is inverted and the integral policy is
     *                                  {@link InvalidIntegralRangeResult#EXCEPTION}
     */
    public BigDecimal nextDecimal(@Nonnull BigDecimal minValue, @Nonnull BigDecimal maxValue) {
        Objects.requireNonNull(minValue, "minValue");
        Objects.requireNonNull(maxValue, "maxValue");
        if (minValue.compareTo(maxValue) > 0) {
            InvalidIntegralRangeResult policy = resolveIntegralPolicy(minValue, maxValue);
            switch (policy) {
                case MIN_BOUND:
                    return minValue;
                case ZERO:
                    return BigDecimal.ZERO;
                case MAX_BOUND:
                    return maxValue;
                default:
                    BigDecimal swap = minValue;
                    minValue = maxValue;
                    maxValue = swap;
                    break;
            }
        }
        return minValue.add(nextDecimal().multiply(maxValue.subtract(minValue)));
    }

    /**
     * Restarts the generator from its current seed. The bit cache used by {@link #nextBool()} is
     * discarded, so an identical series of values follows each reset.
     */
    public void reset() {
        reset(generator.getSeed());
    }

    /**
     * Restarts the generator from the given seed. The bit cache used by {@link #nextBool()} is
     * discarded.
     *
     * @param seed the new seed
     */
    public void reset(int seed) {
        synchronized (bitLock) {
            bitBuffer = 0;
            bitCount = 0;
            generator.reset(seed);
        }
    }

    /**
     * Looks up the integral policy for an inverted range, throwing when the policy says so. Any
     * policy returned other than the three value-returning ones means the bounds are swapped.
     */
    private InvalidIntegralRangeResult resolveIntegralPolicy(Object minValue, Object maxValue) {
        InvalidIntegralRangeResult policy = options.getInvalidIntegralRangeResult();
        log.debug("Inverted range [{}, {}) resolved by policy {}", minValue, maxValue, policy);
        if (policy == InvalidIntegralRangeResult.EXCEPTION) {
            throw new IllegalArgumentException(ErrorMessages.MIN_ABOVE_MAX);
        }
        return policy;
    }

    private static void checkUnsigned(long value, String name) {
        if (value < 0L || value > UINT_MAX_VALUE) {
            throw new IllegalArgumentException(name + " must be an unsigned 32-bit value, got: " + value);
        }
    }
}
