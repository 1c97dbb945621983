package com.hsbc.randomize.parameters;

/**
 * Thrown when text cannot be parsed as {@link DistributionParameters}.
 */
public class ParameterFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ParameterFormatException(String message) {
        super(message);
    }

    public ParameterFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
