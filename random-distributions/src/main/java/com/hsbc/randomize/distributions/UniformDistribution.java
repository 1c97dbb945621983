package com.hsbc.randomize.distributions;

import com.hsbc.randomize.generator.RandomNumberGenerator;
import java.util.Objects;
import java.util.stream.DoubleStream;
import java.util.stream.IntStream;
import java.util.stream.LongStream;
import javax.annotation.Nonnull;

/**
 * Uniform distributions, continuous over {@code [minimum, maximum)} and discrete over
 * {@code [minimum, maximum]}. Inverted bounds are resolved by the generator's range policies on
 * every draw.
 */
public final class UniformDistribution {

    private UniformDistribution() {
    }

    /**
     * Mean and median are the midpoint; the mode is undefined.
     */
    public static DistributionProperties getProperties(double minimum, double maximum) {
        double width = maximum - minimum;
        double midpoint = (minimum + maximum) / 2;
        return new DistributionProperties(maximum, midpoint, midpoint, minimum, null, width * width / 12);
    }

    /**
     * Properties of the discrete uniform distribution over the whole numbers in
     * {@code [minimum, maximum]}.
     */
    public static DistributionProperties getDiscreteProperties(long minimum, long maximum) {
        double width = (double) maximum - minimum + 1;
        double midpoint = ((double) minimum + maximum) / 2;
        return new DistributionProperties(maximum, midpoint, midpoint, minimum, null, (width * width - 1) / 12);
    }

    public static DoubleStream samples(@Nonnull RandomNumberGenerator generator, int count, double minimum,
                                       double maximum) {
        Objects.requireNonNull(generator, "generator");
        return SampleStreams.doubles(count, () -> generator.nextDouble(minimum, maximum));
    }

    public static IntStream signedSamples(@Nonnull RandomNumberGenerator generator, int count, int minimum,
                                          int maximum) {
        Objects.requireNonNull(generator, "generator");
        return SampleStreams.ints(count, () -> generator.nextInclusive(minimum, maximum));
    }

    /**
     * @throws IllegalArgumentException if a bound is outside {@code [0, 2^32-1]}
     */
    public static LongStream unsignedSamples(@Nonnull RandomNumberGenerator generator, int count, long minimum,
                                             long maximum) {
        Objects.requireNonNull(generator, "generator");
        if (minimum < 0 || minimum > RandomNumberGenerator.UINT_MAX_VALUE
            || maximum < 0 || maximum > RandomNumberGenerator.UINT_MAX_VALUE) {
            throw new IllegalArgumentException(
                String.format("Unsigned bounds must be within [0, %d]: [%d, %d]",
                              RandomNumberGenerator.UINT_MAX_VALUE, minimum, maximum));
        }
        return SampleStreams.longs(count, () -> generator.nextUIntInclusive(minimum, maximum));
    }
}
