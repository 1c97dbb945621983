package com.hsbc.randomize.distributions;

import com.hsbc.randomize.NumberTolerance;
import com.hsbc.randomize.generator.RandomNumberGenerator;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;
import java.util.stream.DoubleStream;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The normal distribution with mean {@code mu} and standard deviation {@code sigma}, optionally
 * truncated to {@code [minimum, maximum]}.
 *
 * <p>Samples come from the polar Box-Muller method and are emitted in pairs; when the requested
 * count is odd the second value of the last pair is discarded.
 */
public final class NormalDistribution {

    private NormalDistribution() {
    }

    public static DistributionProperties getProperties(double mu, double sigma) {
        if (Double.isNaN(mu) || Double.isNaN(sigma)) {
            return DistributionProperties.undefined();
        }
        double deviation = NumberTolerance.atLeastNearlyZero(sigma);
        return new DistributionProperties(
            Double.POSITIVE_INFINITY, mu, mu, Double.NEGATIVE_INFINITY, new double[] {mu}, deviation * deviation);
    }

    public static DoubleStream samples(@Nonnull RandomNumberGenerator generator, int count, double mu, double sigma) {
        return samples(generator, count, mu, sigma, null, null);
    }

    /**
     * Draws normal samples, rejecting pairs with a value outside the bounds. Nearly equal bounds
     * yield the minimum for every sample without drawing from the generator.
     *
     * @param generator the source of uniform values
     * @param count the number of samples; non-positive yields an empty stream
     * @param mu the mean
     * @param sigma the standard deviation; clamped to a tiny positive value
     * @param minimum the optional lower bound
     * @param maximum the optional upper bound
     * @return a lazy, single-pass stream of exactly {@code max(0, count)} samples
     * @throws IllegalArgumentException if the bounds are inverted and the generator's floating
     *                                  range policy is {@code EXCEPTION}
     */
    public static DoubleStream samples(@Nonnull RandomNumberGenerator generator, int count, double mu, double sigma,
                                       @Nullable Double minimum, @Nullable Double maximum) {
        Objects.requireNonNull(generator, "generator");
        if (Double.isNaN(mu) || Double.isNaN(sigma)) {
            return SampleStreams.constant(count, Double.NaN);
        }
        SampleBounds bounds = SampleBounds.resolve(minimum, maximum, generator.getOptions());
        if (bounds.isUndefined()) {
            return SampleStreams.constant(count, Double.NaN);
        }
        Double fixed = bounds.getFixedValue();
        if (fixed != null) {
            return SampleStreams.constant(count, fixed);
        }
        double deviation = NumberTolerance.atLeastNearlyZero(sigma);
        return SampleStreams.doubles(
            count, new PolarPairSampler(generator, mu, deviation, false, DoubleUnaryOperator.identity(), bounds));
    }
}
