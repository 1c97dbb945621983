package com.hsbc.randomize;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Immutable configuration for a generator and for the samplers which draw from it.
 *
 * <p>Options are fixed when a generator is constructed. To change behavior, construct a new
 * generator with a modified copy obtained from one of the {@code with...} methods.
 */
public final class RandomizeOptions {

    /** Options which return the minimum bound for any inverted range. */
    public static final RandomizeOptions DEFAULT =
        new RandomizeOptions(InvalidFloatingRangeResult.MIN_BOUND, InvalidIntegralRangeResult.MIN_BOUND);

    private final InvalidFloatingRangeResult invalidFloatingRangeResult;
    private final InvalidIntegralRangeResult invalidIntegralRangeResult;

    /**
     * Creates a new set of options.
     *
     * @param invalidFloatingRangeResult behavior of floating-point operations given an inverted range
     * @param invalidIntegralRangeResult behavior of integral and decimal operations given an inverted range
     */
    public RandomizeOptions(@Nonnull InvalidFloatingRangeResult invalidFloatingRangeResult,
                            @Nonnull InvalidIntegralRangeResult invalidIntegralRangeResult) {
        this.invalidFloatingRangeResult = Objects.requireNonNull(invalidFloatingRangeResult, "invalidFloatingRangeResult");
        this.invalidIntegralRangeResult = Objects.requireNonNull(invalidIntegralRangeResult, "invalidIntegralRangeResult");
    }

    public InvalidFloatingRangeResult getInvalidFloatingRangeResult() {
        return invalidFloatingRangeResult;
    }

    public InvalidIntegralRangeResult getInvalidIntegralRangeResult() {
        return invalidIntegralRangeResult;
    }

    /**
     * Returns a copy of these options with a different floating-point range policy.
     *
     * @param result the new policy
     * @return the modified copy
     */
    public RandomizeOptions withInvalidFloatingRangeResult(@Nonnull InvalidFloatingRangeResult result) {
        return new RandomizeOptions(result, invalidIntegralRangeResult);
    }

    /**
     * Returns a copy of these options with a different integral range policy.
     *
     * @param result the new policy
     * @return the modified copy
     */
    public RandomizeOptions withInvalidIntegralRangeResult(@Nonnull InvalidIntegralRangeResult result) {
        return new RandomizeOptions(invalidFloatingRangeResult, result);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        RandomizeOptions that = (RandomizeOptions) obj;
        return invalidFloatingRangeResult == that.invalidFloatingRangeResult
            && invalidIntegralRangeResult == that.invalidIntegralRangeResult;
    }

    @Override
    public int hashCode() {
        return Objects.hash(invalidFloatingRangeResult, invalidIntegralRangeResult);
    }

    @Override
    public String toString() {
        return String.format("RandomizeOptions{floating=%s, integral=%s}",
                             invalidFloatingRangeResult, invalidIntegralRangeResult);
    }
}
