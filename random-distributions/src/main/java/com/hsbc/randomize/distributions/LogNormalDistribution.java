package com.hsbc.randomize.distributions;

import com.hsbc.randomize.NumberTolerance;
import com.hsbc.randomize.generator.RandomNumberGenerator;
import java.util.Objects;
import java.util.stream.DoubleStream;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The distribution of {@code exp(X)} where {@code X} is normal with mean {@code mu} and standard
 * deviation {@code sigma}. Bounds apply to the exponentiated value.
 */
public final class LogNormalDistribution {

    private LogNormalDistribution() {
    }

    public static DistributionProperties getProperties(double mu, double sigma) {
        if (Double.isNaN(mu) || Double.isNaN(sigma)) {
            return DistributionProperties.undefined();
        }
        double deviation = NumberTolerance.atLeastNearlyZero(sigma);
        double variance = deviation * deviation;
        return new DistributionProperties(
            Double.POSITIVE_INFINITY,
            Math.exp(mu + variance / 2),
            Math.exp(mu),
            0,
            new double[] {Math.exp(mu - variance)},
            Math.expm1(variance) * Math.exp(2 * mu + variance));
    }

    public static DoubleStream samples(@Nonnull RandomNumberGenerator generator, int count, double mu, double sigma) {
        return samples(generator, count, mu, sigma, null, null);
    }

    /**
     * Draws samples, rejecting pairs with a value outside the bounds. A minimum at or below zero
     * does not constrain the draw; a maximum at or below zero leaves only zero, so every sample is
     * zero.
     *
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
        Double upper = bounds.getMaximum();
        if (upper != null && (upper <= 0 || NumberTolerance.isNearlyZero(upper))) {
            return SampleStreams.constant(count, 0.0);
        }
        Double lower = bounds.getMinimum() != null && bounds.getMinimum() > 0 ? bounds.getMinimum() : null;
        double deviation = NumberTolerance.atLeastNearlyZero(sigma);
        return SampleStreams.doubles(
            count, new PolarPairSampler(generator, mu, deviation, false, Math::exp,
                                        SampleBounds.resolve(lower, upper, generator.getOptions())));
    }
}
