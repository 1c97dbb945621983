package com.hsbc.randomize.distributions;

import com.hsbc.randomize.generator.RandomNumberGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Spliterator;
import java.util.stream.DoubleStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("UniformDistribution Tests")
class UniformDistributionTest {

    @Test
    @DisplayName("Should compute continuous properties")
    void shouldComputeContinuousProperties() {
        DistributionProperties properties = UniformDistribution.getProperties(0, 1);

        assertThat(properties.getMean()).isEqualTo(0.5);
        assertThat(properties.getMedian()).isEqualTo(0.5);
        assertThat(properties.getVariance()).isCloseTo(1.0 / 12, within(1e-15));
        assertThat(properties.getMode()).containsExactly(Double.NaN);
    }

    @Test
    @DisplayName("Should compute discrete properties")
    void shouldComputeDiscreteProperties() {
        DistributionProperties properties = UniformDistribution.getDiscreteProperties(1, 6);

        assertThat(properties.getMinimum()).isEqualTo(1.0);
        assertThat(properties.getMaximum()).isEqualTo(6.0);
        assertThat(properties.getMean()).isEqualTo(3.5);
        assertThat(properties.getVariance()).isCloseTo(35.0 / 12, within(1e-12));
    }

    @Test
    @DisplayName("Should keep continuous samples within [minimum, maximum)")
    void shouldSampleContinuousRange() {
        double[] samples = UniformDistribution.samples(new RandomNumberGenerator(1), 10_000, -2, 3).toArray();

        assertThat(DoubleStream.of(samples).allMatch(value -> value >= -2 && value < 3)).isTrue();
    }

    @Test
    @DisplayName("Should cover every value of an inclusive discrete range")
    void shouldSampleDiscreteRange() {
        assertThat(UniformDistribution.signedSamples(new RandomNumberGenerator(1), 10_000, 1, 6).toArray())
            .containsOnly(1, 2, 3, 4, 5, 6);
        assertThat(UniformDistribution.unsignedSamples(new RandomNumberGenerator(1), 10_000, 4_294_967_290L,
                                                       RandomNumberGenerator.UINT_MAX_VALUE).toArray())
            .containsOnly(4_294_967_290L, 4_294_967_291L, 4_294_967_292L, 4_294_967_293L, 4_294_967_294L,
                          4_294_967_295L);
    }

    @Test
    @DisplayName("Should reject unsigned bounds outside 32 bits")
    void shouldRejectUnsignedOverflow() {
        assertThatThrownBy(() -> UniformDistribution.unsignedSamples(new RandomNumberGenerator(1), 1, -1, 5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should report its exact size and allow a single traversal")
    void shouldBeSizedAndSinglePass() {
        // Given
        DoubleStream samples = UniformDistribution.samples(new RandomNumberGenerator(1), 12, 0, 1);
        Spliterator.OfDouble spliterator = samples.spliterator();

        // Then
        assertThat(spliterator.hasCharacteristics(Spliterator.SIZED)).isTrue();
        assertThat(spliterator.getExactSizeIfKnown()).isEqualTo(12L);
        assertThatThrownBy(samples::count).isInstanceOf(IllegalStateException.class);
    }
}
