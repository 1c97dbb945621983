package com.hsbc.randomize.distributions;

import com.hsbc.randomize.generator.RandomNumberGenerator;
import java.util.Objects;
import java.util.stream.IntStream;
import javax.annotation.Nonnull;

/**
 * The number of successes in {@code n} independent trials, each succeeding with probability
 * {@code p}.
 */
public final class BinomialDistribution {

    private BinomialDistribution() {
    }

    /**
     * Computes the properties of a binomial distribution. The median has no closed form and is
     * reported as NaN.
     *
     * @param n the number of trials
     * @param p the probability of success; clamped to [0, 1]
     * @return the properties
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public static DistributionProperties getProperties(int n, double p) {
        checkTrials(n);
        if (Double.isNaN(p)) {
            return new DistributionProperties(n, Double.NaN, Double.NaN, 0, null, Double.NaN);
        }
        double probability = clamp(p);
        return new DistributionProperties(
            n,
            n * probability,
            Double.NaN,
            0,
            new double[] {Math.floor(probability * (n + 1))},
            n * probability * (1 - probability));
    }

    /**
     * Draws binomial samples. Each sample consumes {@code n} words from the generator.
     *
     * @param generator the source of uniform values
     * @param count the number of samples; non-positive yields an empty stream
     * @param n the number of trials
     * @param p the probability of success; clamped to [0, 1]
     * @return a lazy, single-pass stream of exactly {@code max(0, count)} samples
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public static IntStream samples(@Nonnull RandomNumberGenerator generator, int count, int n, double p) {
        Objects.requireNonNull(generator, "generator");
        checkTrials(n);
        double probability = Double.isNaN(p) ? p : clamp(p);
        return SampleStreams.ints(count, () -> {
            int successes = 0;
            for (int trial = 0; trial < n; trial++) {
                if (generator.nextDouble() <= probability) {
                    successes++;
                }
            }
            return successes;
        });
    }

    private static void checkTrials(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("The number of trials cannot be negative: " + n);
        }
    }

    private static double clamp(double p) {
        return Math.max(0.0, Math.min(1.0, p));
    }
}
