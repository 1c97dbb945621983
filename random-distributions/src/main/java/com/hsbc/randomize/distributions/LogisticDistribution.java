package com.hsbc.randomize.distributions;

import com.hsbc.randomize.NumberTolerance;
import com.hsbc.randomize.generator.RandomNumberGenerator;
import java.util.Objects;
import java.util.stream.DoubleStream;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The logistic distribution with location {@code mu} and scale {@code sigma}, optionally
 * truncated to {@code [minimum, maximum]}.
 */
public final class LogisticDistribution {

    private LogisticDistribution() {
    }

    public static DistributionProperties getProperties(double mu, double sigma) {
        if (Double.isNaN(mu) || Double.isNaN(sigma)) {
            return DistributionProperties.undefined();
        }
        double scale = NumberTolerance.atLeastNearlyZero(sigma);
        return new DistributionProperties(
            Double.POSITIVE_INFINITY, mu, mu, Double.NEGATIVE_INFINITY, new double[] {mu},
            scale * scale * Math.PI * Math.PI / 3);
    }

    public static DoubleStream samples(@Nonnull RandomNumberGenerator generator, int count, double mu, double sigma) {
        return samples(generator, count, mu, sigma, null, null);
    }

    /**
     * Draws samples by inversion of the logistic CDF, redrawing any sample outside the bounds.
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
        double scale = NumberTolerance.atLeastNearlyZero(sigma);
        return SampleStreams.doubles(count, () -> {
            double sample;
            do {
                double u;
                do {
                    u = generator.nextDouble();
                } while (NumberTolerance.isNearlyZero(u * (1 - u)));
                sample = mu + scale * Math.log(u / (1 - u));
            } while (!bounds.contains(sample));
            return sample;
        });
    }
}
