package com.hsbc.randomize.distributions;

import com.hsbc.randomize.ErrorMessages;
import com.hsbc.randomize.NumberTolerance;
import com.hsbc.randomize.generator.RandomNumberGenerator;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;
import javax.annotation.Nonnull;

/**
 * Draws a category index in {@code [0, k)}, each index chosen with probability proportional to
 * its weight.
 *
 * <p>Sampling precomputes the cumulative distribution once per call to {@code samples}, then maps
 * each uniform value {@code u} to the first index whose cumulative weight is at least {@code u}.
 */
public final class CategoricalDistribution {

    private static final double NORMALIZED_TOLERANCE = 1e-12;

    private static final int DEFAULT_CATEGORIES = 3;

    private CategoricalDistribution() {
    }

    /**
     * Normalizes a weight vector: negative weights become zero and the result sums to one.
     * Weights already summing to one within a tight tolerance are returned unchanged, so
     * normalization is idempotent. An empty vector means three equally likely categories, and a
     * vector holding a NaN normalizes to all NaN.
     *
     * @param weights the raw weights
     * @return a new array of normalized weights
     * @throws IllegalArgumentException if no weight is positive
     */
    public static double[] normalize(@Nonnull double[] weights) {
        Objects.requireNonNull(weights, "weights");
        if (weights.length == 0) {
            return equalWeights(DEFAULT_CATEGORIES);
        }
        double[] normalized = new double[weights.length];
        if (hasUndefinedWeight(weights)) {
            Arrays.fill(normalized, Double.NaN);
            return normalized;
        }
        double total = 0;
        for (int i = 0; i < weights.length; i++) {
            double weight = Math.max(0.0, weights[i]);
            normalized[i] = weight;
            total += weight;
        }
        if (NumberTolerance.isNearlyZero(total)) {
            throw new IllegalArgumentException(ErrorMessages.TOTAL_WEIGHT_IS_ZERO);
        }
        if (Math.abs(total - 1.0) > NORMALIZED_TOLERANCE) {
            for (int i = 0; i < normalized.length; i++) {
                normalized[i] /= total;
            }
        }
        return normalized;
    }

    /**
     * Weights for {@code k} equally likely categories. A {@code k} below one means a single
     * category.
     *
     * @param k the number of categories
     * @return {@code max(1, k)} weights of equal value
     */
    public static double[] equalWeights(int k) {
        int categories = Math.max(1, k);
        double[] weights = new double[categories];
        Arrays.fill(weights, 1.0 / categories);
        return weights;
    }

    public static boolean hasUndefinedWeight(@Nonnull double[] weights) {
        for (double weight : weights) {
            if (Double.isNaN(weight)) {
                return true;
            }
        }
        return false;
    }

    public static DistributionProperties getProperties(int k) {
        return getProperties(equalWeights(k));
    }

    /**
     * Computes the properties of the distribution, using the category index as the value.
     *
     * @param weights the raw weights; normalized first
     * @return the properties, all undefined if a weight is NaN
     * @throws IllegalArgumentException if no weight is positive
     */
    public static DistributionProperties getProperties(@Nonnull double[] weights) {
        double[] normalized = normalize(weights);
        if (hasUndefinedWeight(normalized)) {
            return DistributionProperties.undefined();
        }
        double[] cdf = cumulative(normalized);

        double mean = 0;
        int mode = 0;
        for (int i = 0; i < normalized.length; i++) {
            mean += i * normalized[i];
            if (normalized[i] > normalized[mode]) {
                mode = i;
            }
        }

        int median = 0;
        while (median < cdf.length - 1 && cdf[median] < 0.5) {
            median++;
        }

        double variance = 0;
        for (int i = 0; i < normalized.length; i++) {
            variance += normalized[i] * (i - mean) * (i - mean);
        }

        return new DistributionProperties(normalized.length - 1, mean, median, 0, new double[] {mode}, variance);
    }

    public static IntStream samples(@Nonnull RandomNumberGenerator generator, int count, int k) {
        return samples(generator, count, equalWeights(k));
    }

    /**
     * Draws category indices.
     *
     * @param generator the source of uniform values
     * @param count the number of samples; non-positive yields an empty stream
     * @param weights the raw weights; normalized first
     * @return a lazy, single-pass stream of exactly {@code max(0, count)} indices
     * @throws IllegalArgumentException if no weight is positive or a weight is NaN
     */
    public static IntStream samples(@Nonnull RandomNumberGenerator generator, int count, @Nonnull double[] weights) {
        Objects.requireNonNull(generator, "generator");
        double[] normalized = normalize(weights);
        if (hasUndefinedWeight(normalized)) {
            throw new IllegalArgumentException(ErrorMessages.UNDEFINED_WEIGHT);
        }
        double[] cdf = cumulative(normalized);
        return SampleStreams.ints(count, () -> search(cdf, generator.nextDouble()));
    }

    private static double[] cumulative(double[] normalized) {
        double[] cdf = new double[normalized.length];
        double sum = 0;
        for (int i = 0; i < normalized.length; i++) {
            sum += normalized[i];
            cdf[i] = sum;
        }
        // Every u in [0, 1) must land on an index.
        cdf[cdf.length - 1] = 1.0;
        return cdf;
    }

    private static int search(double[] cdf, double u) {
        int low = 0;
        int high = cdf.length - 1;
        while (low < high) {
            int index = low + (high - low) / 2;
            double boundary = cdf[index];
            if (NumberTolerance.isNearlyEqual(u, boundary)) {
                return index;
            }
            if (u < boundary) {
                high = index;
            } else {
                low = index + 1;
            }
        }
        return low;
    }
}
