package com.hsbc.randomize;

/**
 * Determines what an integral (or decimal) operation returns when it is given a minimum bound
 * that is greater than its maximum bound.
 */
public enum InvalidIntegralRangeResult {
    /** The minimum bound is returned. */
    MIN_BOUND,
    /** Zero is returned. */
    ZERO,
    /** The maximum bound is returned. */
    MAX_BOUND,
    /** The bounds are swapped and the operation proceeds. */
    SWAP,
    /** An {@link IllegalArgumentException} is thrown. */
    EXCEPTION
}
