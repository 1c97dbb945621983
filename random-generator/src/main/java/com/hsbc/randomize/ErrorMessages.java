package com.hsbc.randomize;

/**
 * Exception texts shared by the generator and the distribution samplers.
 */
public final class ErrorMessages {

    public static final String MIN_ABOVE_MAX = "The minimum bound cannot be greater than the maximum bound.";
    public static final String NULL_BUFFER = "Buffer cannot be null.";
    public static final String TOTAL_WEIGHT_IS_ZERO = "Total weight cannot be zero.";
    public static final String UNDEFINED_WEIGHT = "Weights cannot be NaN.";

    private ErrorMessages() {
    }
}
