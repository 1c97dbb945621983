package com.hsbc.randomize.distributions;

import com.hsbc.randomize.ErrorMessages;
import com.hsbc.randomize.InvalidFloatingRangeResult;
import com.hsbc.randomize.NumberTolerance;
import com.hsbc.randomize.RandomizeOptions;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Optional clipping bounds for a sampler, after any inversion has been resolved by the floating
 * range policy. Samples outside the bounds are rejected and redrawn.
 */
final class SampleBounds {

    private static final Logger log = LoggerFactory.getLogger(SampleBounds.class);

    @Nullable
    private final Double minimum;
    @Nullable
    private final Double maximum;
    private final boolean undefined;

    private SampleBounds(@Nullable Double minimum, @Nullable Double maximum, boolean undefined) {
        this.minimum = minimum;
        this.maximum = maximum;
        this.undefined = undefined;
    }

    /**
     * Resolves the caller's bounds. A NaN bound makes every sample NaN. An inverted pair is
     * handled as the policy dictates: clamped to one bound, collapsed to zero, swapped, rejected,
     * or marked undefined.
     *
     * @throws IllegalArgumentException if the bounds are inverted and the policy is
     *                                  {@link InvalidFloatingRangeResult#EXCEPTION}
     */
    static SampleBounds resolve(@Nullable Double minimum, @Nullable Double maximum, RandomizeOptions options) {
        if ((minimum != null && minimum.isNaN()) || (maximum != null && maximum.isNaN())) {
            return new SampleBounds(null, null, true);
        }
        if (minimum == null || maximum == null || minimum <= maximum) {
            return new SampleBounds(minimum, maximum, false);
        }
        InvalidFloatingRangeResult policy = options.getInvalidFloatingRangeResult();
        log.debug("Inverted sampling bounds [{}, {}] resolved by policy {}", minimum, maximum, policy);
        switch (policy) {
            case MIN_BOUND:
                return new SampleBounds(minimum, minimum, false);
            case ZERO:
                return new SampleBounds(0.0, 0.0, false);
            case MAX_BOUND:
                return new SampleBounds(maximum, maximum, false);
            case SWAP:
                return new SampleBounds(maximum, minimum, false);
            case NAN:
                return new SampleBounds(null, null, true);
            default:
                throw new IllegalArgumentException(ErrorMessages.MIN_ABOVE_MAX);
        }
    }

    @Nullable
    Double getMinimum() {
        return minimum;
    }

    @Nullable
    Double getMaximum() {
        return maximum;
    }

    /** Whether the policy demands that every sample be NaN. */
    boolean isUndefined() {
        return undefined;
    }

    /**
     * The only value the bounds admit, when rejection sampling could never succeed: nearly equal
     * bounds, a minimum of positive infinity or a maximum of negative infinity.
     *
     * @return the value every sample must take, or {@code null} if the bounds leave room
     */
    @Nullable
    Double getFixedValue() {
        if (minimum != null && minimum == Double.POSITIVE_INFINITY) {
            return minimum;
        }
        if (maximum != null && maximum == Double.NEGATIVE_INFINITY) {
            return maximum;
        }
        if (minimum != null && maximum != null && NumberTolerance.isNearlyEqual(minimum, maximum)) {
            return minimum;
        }
        return null;
    }

    boolean contains(double value) {
        return (minimum == null || value >= minimum) && (maximum == null || value <= maximum);
    }
}
