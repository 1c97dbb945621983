package com.hsbc.randomize.distributions;

import com.hsbc.randomize.NumberTolerance;
import com.hsbc.randomize.generator.RandomNumberGenerator;
import java.util.Objects;
import java.util.stream.DoubleStream;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The exponential distribution with rate {@code lambda}, optionally truncated above.
 */
public final class ExponentialDistribution {

    private static final double LN_2 = Math.log(2);

    private ExponentialDistribution() {
    }

    /**
     * @param lambda the rate; values at or below zero are clamped to a tiny positive rate
     */
    public static DistributionProperties getProperties(double lambda) {
        if (Double.isNaN(lambda)) {
            return DistributionProperties.undefined();
        }
        double rate = NumberTolerance.atLeastNearlyZero(lambda);
        return new DistributionProperties(
            Double.POSITIVE_INFINITY, 1 / rate, LN_2 / rate, 0, new double[] {0}, 1 / (rate * rate));
    }

    public static DoubleStream samples(@Nonnull RandomNumberGenerator generator, int count, double lambda) {
        return samples(generator, count, lambda, null);
    }

    /**
     * Draws samples by inversion, redrawing any sample above {@code maximum}. A maximum at or
     * below zero leaves only zero in the support, so every sample is zero.
     *
     * @param generator the source of uniform values
     * @param count the number of samples; non-positive yields an empty stream
     * @param lambda the rate
     * @param maximum the optional upper bound
     * @return a lazy, single-pass stream of exactly {@code max(0, count)} samples
     */
    public static DoubleStream samples(@Nonnull RandomNumberGenerator generator, int count, double lambda,
                                       @Nullable Double maximum) {
        Objects.requireNonNull(generator, "generator");
        if (Double.isNaN(lambda) || (maximum != null && maximum.isNaN())) {
            return SampleStreams.constant(count, Double.NaN);
        }
        if (maximum != null && (maximum <= 0 || NumberTolerance.isNearlyZero(maximum))) {
            return SampleStreams.constant(count, 0.0);
        }
        double rate = NumberTolerance.atLeastNearlyZero(lambda);
        return SampleStreams.doubles(count, () -> {
            double sample;
            do {
                sample = -Math.log(nonZeroUniform(generator)) / rate;
            } while (maximum != null && sample > maximum);
            return sample;
        });
    }

    private static double nonZeroUniform(RandomNumberGenerator generator) {
        double u;
        do {
            u = generator.nextDouble();
        } while (NumberTolerance.isNearlyZero(u));
        return u;
    }
}
