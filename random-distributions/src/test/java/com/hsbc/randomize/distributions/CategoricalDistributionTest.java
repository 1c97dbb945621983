package com.hsbc.randomize.distributions;

import com.hsbc.randomize.ErrorMessages;
import com.hsbc.randomize.generator.RandomNumberGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CategoricalDistribution Tests")
class CategoricalDistributionTest {

    @Test
    @DisplayName("Should normalize weights to sum to one")
    void shouldNormalizeWeights() {
        assertThat(CategoricalDistribution.normalize(new double[] {1, 1, 2})).containsExactly(0.25, 0.25, 0.5);
    }

    @Test
    @DisplayName("Should treat negative weights as zero")
    void shouldClampNegativeWeights() {
        assertThat(CategoricalDistribution.normalize(new double[] {-3, 1, 3})).containsExactly(0.0, 0.25, 0.75);
    }

    @Test
    @DisplayName("Should leave already normalized weights untouched")
    void shouldBeIdempotent() {
        // Given
        double[] once = CategoricalDistribution.normalize(new double[] {0.3, 1.1, 7.7, 0.01});

        // When
        double[] twice = CategoricalDistribution.normalize(once);

        // Then
        assertThat(twice).containsExactly(once);
    }

    @Test
    @DisplayName("Should reject weights with no positive entry")
    void shouldRejectZeroTotalWeight() {
        assertThatThrownBy(() -> CategoricalDistribution.normalize(new double[] {0, -1, 0}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage(ErrorMessages.TOTAL_WEIGHT_IS_ZERO);
        assertThatThrownBy(() -> CategoricalDistribution.samples(new RandomNumberGenerator(1), 10, new double[] {0, 0}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should compute properties from normalized weights")
    void shouldComputeProperties() {
        // When
        DistributionProperties properties = CategoricalDistribution.getProperties(new double[] {1, 1, 2});

        // Then
        assertThat(properties.getMinimum()).isEqualTo(0.0);
        assertThat(properties.getMaximum()).isEqualTo(2.0);
        assertThat(properties.getMean()).isEqualTo(1.25);
        assertThat(properties.getMedian()).isEqualTo(1.0);
        assertThat(properties.getMode()).containsExactly(2.0);
        assertThat(properties.getVariance()).isCloseTo(0.6875, within(1e-12));
    }

    @Test
    @DisplayName("Should describe k equally likely categories")
    void shouldDescribeEqualCategories() {
        DistributionProperties properties = CategoricalDistribution.getProperties(4);

        assertThat(properties.getMaximum()).isEqualTo(3.0);
        assertThat(properties.getMean()).isCloseTo(1.5, within(1e-12));
        assertThat(properties.getMode()).containsExactly(0.0);
    }

    @Test
    @DisplayName("Should draw categories with frequencies matching their weights")
    void shouldMatchWeightFrequencies() {
        // Given
        RandomNumberGenerator generator = new RandomNumberGenerator(2024);
        int draws = 100_000;
        int[] counts = new int[3];

        // When
        CategoricalDistribution.samples(generator, draws, new double[] {1, 1, 2}).forEach(index -> counts[index]++);

        // Then
        assertThat(counts[0] + counts[1] + counts[2]).isEqualTo(draws);
        assertThat((double) counts[0] / draws).isCloseTo(0.25, within(0.01));
        assertThat((double) counts[1] / draws).isCloseTo(0.25, within(0.01));
        assertThat((double) counts[2] / draws).isCloseTo(0.5, within(0.01));
    }

    @Test
    @DisplayName("Should never draw a category with zero weight")
    void shouldSkipZeroWeightCategories() {
        RandomNumberGenerator generator = new RandomNumberGenerator(77);

        assertThat(CategoricalDistribution.samples(generator, 20_000, new double[] {1, 0, 0, 1}).toArray())
            .containsOnly(0, 3);
    }

    @Test
    @DisplayName("Should always draw the single category")
    void shouldDrawSingleCategory() {
        assertThat(CategoricalDistribution.samples(new RandomNumberGenerator(5), 50, 1).toArray())
            .hasSize(50)
            .containsOnly(0);
    }

    @Test
    @DisplayName("Should treat a non-positive number of categories as one")
    void shouldClampCategoryCount() {
        assertThat(CategoricalDistribution.equalWeights(0)).containsExactly(1.0);
        assertThat(CategoricalDistribution.getProperties(-4).getMaximum()).isEqualTo(0.0);
        assertThat(CategoricalDistribution.samples(new RandomNumberGenerator(5), 10, 0).toArray())
            .hasSize(10)
            .containsOnly(0);
    }

    @Test
    @DisplayName("Should default empty weights to three equal categories")
    void shouldDefaultEmptyWeights() {
        // Given
        RandomNumberGenerator generator = new RandomNumberGenerator(31);

        // When
        int[] samples = CategoricalDistribution.samples(generator, 3_000, new double[0]).toArray();
        DistributionProperties properties = CategoricalDistribution.getProperties(new double[0]);

        // Then
        assertThat(samples).hasSize(3_000).containsOnly(0, 1, 2);
        assertThat(properties.getMaximum()).isEqualTo(2.0);
        assertThat(properties.getMean()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should leave every property undefined when a weight is NaN")
    void shouldPropagateNaNWeight() {
        // When
        DistributionProperties properties = CategoricalDistribution.getProperties(new double[] {1, Double.NaN, 1});

        // Then
        assertThat(CategoricalDistribution.normalize(new double[] {1, Double.NaN, 1})).hasSize(3).containsOnly(Double.NaN);
        assertThat(properties.getMean()).isNaN();
        assertThat(properties.getVariance()).isNaN();
        assertThat(properties.getMode()).containsExactly(Double.NaN);
    }

    @Test
    @DisplayName("Should refuse to draw indices from NaN weights")
    void shouldRejectSamplingNaNWeights() {
        assertThatThrownBy(() -> CategoricalDistribution.samples(new RandomNumberGenerator(1), 5,
                                                                 new double[] {Double.NaN, 1}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage(ErrorMessages.UNDEFINED_WEIGHT);
    }
}
