package com.hsbc.randomize.distributions;

import java.util.Arrays;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * The descriptive properties of a distribution: its support and its central moments.
 *
 * <p>Instances are immutable and always recomputed from shape parameters; nothing is cached.
 * A distribution may have several modes, or none which is well defined, so the mode is an
 * array. An undefined mode is represented by a single {@link Double#NaN}.
 */
public final class DistributionProperties {

    private final double maximum;
    private final double mean;
    private final double median;
    private final double minimum;
    private final double[] mode;
    private final double variance;

    /**
     * Creates a new set of properties.
     *
     * @param maximum the largest value in the support
     * @param mean the mean
     * @param median the median
     * @param minimum the smallest value in the support
     * @param mode the mode(s); {@code null} or empty means undefined
     * @param variance the variance
     */
    public DistributionProperties(double maximum, double mean, double median, double minimum,
                                  @Nullable double[] mode, double variance) {
        this.maximum = maximum;
        this.mean = mean;
        this.median = median;
        this.minimum = minimum;
        this.mode = mode == null || mode.length == 0 ? new double[] {Double.NaN} : mode.clone();
        this.variance = variance;
    }

    /**
     * Properties in which every value is NaN, describing a distribution with a NaN shape
     * parameter.
     *
     * @return the all-NaN properties
     */
    public static DistributionProperties undefined() {
        return new DistributionProperties(Double.NaN, Double.NaN, Double.NaN, Double.NaN, null, Double.NaN);
    }

    public double getMaximum() {
        return maximum;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getMinimum() {
        return minimum;
    }

    /**
     * Gets the mode(s) of the distribution.
     *
     * @return a copy of the modes; a single NaN when undefined
     */
    public double[] getMode() {
        return mode.clone();
    }

    public double getVariance() {
        return variance;
    }

    public double getStandardDeviation() {
        return Math.sqrt(variance);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        DistributionProperties that = (DistributionProperties) obj;
        return Double.compare(maximum, that.maximum) == 0
            && Double.compare(mean, that.mean) == 0
            && Double.compare(median, that.median) == 0
            && Double.compare(minimum, that.minimum) == 0
            && Arrays.equals(mode, that.mode)
            && Double.compare(variance, that.variance) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(maximum, mean, median, minimum, variance) + Arrays.hashCode(mode);
    }

    @Override
    public String toString() {
        return String.format("DistributionProperties{min=%s, max=%s, mean=%s, median=%s, mode=%s, variance=%s}",
                             minimum, maximum, mean, median, Arrays.toString(mode), variance);
    }
}
