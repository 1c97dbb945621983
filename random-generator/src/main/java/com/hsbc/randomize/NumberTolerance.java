package com.hsbc.randomize;

import org.apache.commons.math3.util.Precision;

/**
 * Floating-point tolerances used wherever a value must be treated as "effectively" zero or
 * "effectively" equal to another.
 */
public final class NumberTolerance {

    /**
     * The smallest value treated as strictly positive. Shape parameters which must be positive
     * are raised to this value when given as zero or a negative number.
     */
    public static final double NEARLY_ZERO = 1e-15;

    private NumberTolerance() {
    }

    /**
     * Determines whether the value is within {@link #NEARLY_ZERO} of zero.
     *
     * @param value the value to test
     * @return {@code true} if the value is nearly zero; {@code false} for NaN
     */
    public static boolean isNearlyZero(double value) {
        return Math.abs(value) <= NEARLY_ZERO;
    }

    /**
     * Determines whether two values are equal within {@link #NEARLY_ZERO}, either absolutely or
     * relative to their magnitude.
     *
     * @param first the first value
     * @param second the second value
     * @return {@code true} if the values are nearly equal
     */
    public static boolean isNearlyEqual(double first, double second) {
        return Precision.equals(first, second, NEARLY_ZERO)
            || Precision.equalsWithRelativeTolerance(first, second, NEARLY_ZERO);
    }

    /**
     * Raises a value which is not strictly positive to {@link #NEARLY_ZERO}. NaN is returned
     * unchanged.
     *
     * @param value the value to clamp
     * @return the clamped value
     */
    public static double atLeastNearlyZero(double value) {
        if (Double.isNaN(value)) {
            return value;
        }
        return Math.max(NEARLY_ZERO, value);
    }
}
