package com.hsbc.randomize.distributions;

import com.hsbc.randomize.NumberTolerance;
import com.hsbc.randomize.generator.RandomNumberGenerator;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;
import java.util.stream.DoubleStream;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A normal distribution folded onto its upper half: {@code mu + |X - mu|}. Its support starts at
 * {@code mu}.
 */
public final class PositiveNormalDistribution {

    private PositiveNormalDistribution() {
    }

    /**
     * Mean and median are left undefined (NaN).
     */
    public static DistributionProperties getProperties(double mu, double sigma) {
        if (Double.isNaN(mu) || Double.isNaN(sigma)) {
            return DistributionProperties.undefined();
        }
        double deviation = NumberTolerance.atLeastNearlyZero(sigma);
        return new DistributionProperties(
            Double.POSITIVE_INFINITY, Double.NaN, Double.NaN, mu, new double[] {mu}, deviation * deviation);
    }

    public static DoubleStream samples(@Nonnull RandomNumberGenerator generator, int count, double mu, double sigma) {
        return samples(generator, count, mu, sigma, null);
    }

    /**
     * Draws samples, rejecting pairs with a value above {@code maximum}. A maximum nearly equal
     * to or below {@code mu} yields {@code mu} for every sample; a NaN maximum yields NaN.
     */
    public static DoubleStream samples(@Nonnull RandomNumberGenerator generator, int count, double mu, double sigma,
                                       @Nullable Double maximum) {
        Objects.requireNonNull(generator, "generator");
        if (Double.isNaN(mu) || Double.isNaN(sigma)) {
            return SampleStreams.constant(count, Double.NaN);
        }
        if (maximum != null && maximum.isNaN()) {
            return SampleStreams.constant(count, Double.NaN);
        }
        if (maximum != null && (maximum < mu || NumberTolerance.isNearlyEqual(maximum, mu))) {
            return SampleStreams.constant(count, mu);
        }
        double deviation = NumberTolerance.atLeastNearlyZero(sigma);
        SampleBounds bounds = SampleBounds.resolve(null, maximum, generator.getOptions());
        return SampleStreams.doubles(
            count, new PolarPairSampler(generator, mu, deviation, true, DoubleUnaryOperator.identity(), bounds));
    }
}
