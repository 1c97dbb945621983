package com.hsbc.randomize.parameters;

import com.hsbc.randomize.ErrorMessages;
import com.hsbc.randomize.NumberTolerance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DistributionParameters Tests")
class DistributionParametersTest {

    @Nested
    @DisplayName("Invariants")
    class Invariants {

        @Test
        @DisplayName("Should store infinite outer bounds as absent")
        void shouldNormalizeInfiniteBounds() {
            DistributionParameters parameters = DistributionParameters.normal(
                0, 1, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, null);

            assertThat(parameters.getMinimum()).isNull();
            assertThat(parameters.getMaximum()).isNull();
            assertThat(parameters).isEqualTo(DistributionParameters.normal());
        }

        @Test
        @DisplayName("Should keep an infinite inner bound")
        void shouldKeepInnerInfiniteBound() {
            DistributionParameters parameters = DistributionParameters.continuousUniform(
                Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, null);

            assertThat(parameters.getMinimum()).isEqualTo(Double.POSITIVE_INFINITY);
            assertThat(parameters.getMaximum()).isEqualTo(Double.NEGATIVE_INFINITY);
        }

        @Test
        @DisplayName("Should clamp a non-positive scale or rate")
        void shouldClampScale() {
            assertThat(DistributionParameters.normal(0, -2).getSigma()).isEqualTo(NumberTolerance.NEARLY_ZERO);
            assertThat(DistributionParameters.exponential(0).getLambda()).isEqualTo(NumberTolerance.NEARLY_ZERO);
            assertThat(DistributionParameters.logistic(0, Double.NaN).getSigma()).isNaN();
        }

        @Test
        @DisplayName("Should store categorical weights normalized")
        void shouldNormalizeWeights() {
            assertThat(DistributionParameters.categorical(1, 1, 2).getWeights()).containsExactly(0.25, 0.25, 0.5);
            assertThat(DistributionParameters.categorical(-4, 2, 2).getWeights()).containsExactly(0.0, 0.5, 0.5);
        }

        @Test
        @DisplayName("Should default to three equal categories")
        void shouldDefaultWeights() {
            CategoricalParameters parameters = DistributionParameters.categorical();

            assertThat(parameters.getCategoryCount()).isEqualTo(3);
            assertThat(parameters.getWeights()).containsOnly(1.0 / 3);
            assertThat(DistributionParameters.of(DistributionKind.CATEGORICAL, null, null, null, null))
                .isEqualTo(parameters);
        }

        @Test
        @DisplayName("Should reject weights that are all zero")
        void shouldRejectZeroWeights() {
            assertThatThrownBy(() -> DistributionParameters.categorical(0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage(ErrorMessages.TOTAL_WEIGHT_IS_ZERO);
        }

        @Test
        @DisplayName("Should reject a precision outside 0 to 255")
        void shouldRejectPrecision() {
            assertThatThrownBy(() -> DistributionParameters.normal(0, 1, null, null, 256))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> DistributionParameters.normal(0, 1, null, null, -1))
                .isInstanceOf(IllegalArgumentException.class);
            assertThat(DistributionParameters.normal(0, 1, null, null, 255).getPrecision()).isEqualTo(255);
        }

        @Test
        @DisplayName("Should reject binomial trials that are negative or fractional")
        void shouldRejectBadTrials() {
            assertThatThrownBy(() -> DistributionParameters.binomial(-1, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> DistributionParameters.of(
                DistributionKind.BINOMIAL, null, null, new double[] {2.5, 0.5}, null))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject a shape parameter count that does not fit the kind")
        void shouldRejectParameterCount() {
            assertThatThrownBy(() -> DistributionParameters.of(
                DistributionKind.NORMAL, null, null, new double[] {1}, null))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> DistributionParameters.of(
                DistributionKind.CONTINUOUS_UNIFORM, 0.0, 1.0, new double[] {1}, null))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should build each kind from a flat parameter list")
        void shouldBuildFromFlatList() {
            assertThat(DistributionParameters.of(DistributionKind.BINOMIAL, null, null, new double[] {4, 0.25}, null))
                .isEqualTo(DistributionParameters.binomial(4, 0.25));
            assertThat(DistributionParameters.of(DistributionKind.EXPONENTIAL, null, 3.0, new double[] {2}, 1))
                .isEqualTo(DistributionParameters.exponential(2, 3.0, 1));
            assertThat(DistributionParameters.of(DistributionKind.LOG_NORMAL, 1.0, 2.0, new double[] {0, 1}, null))
                .isEqualTo(DistributionParameters.logNormal(0, 1, 1.0, 2.0, null));
        }
    }

    @Nested
    @DisplayName("Equality")
    class Equality {

        @Test
        @DisplayName("Should compare doubles bit-wise")
        void shouldCompareBitwise() {
            assertThat(DistributionParameters.normal(Double.NaN, 1)).isEqualTo(DistributionParameters.normal(Double.NaN, 1));
            assertThat(DistributionParameters.normal(0.0, 1)).isNotEqualTo(DistributionParameters.normal(-0.0, 1));
        }

        @Test
        @DisplayName("Should distinguish kinds with the same shape")
        void shouldDistinguishKinds() {
            assertThat(DistributionParameters.normal(0, 1)).isNotEqualTo(DistributionParameters.logistic(0, 1));
            assertThat(DistributionParameters.normal(0, 1).hashCode())
                .isEqualTo(DistributionParameters.normal(0, 1).hashCode());
        }

        @Test
        @DisplayName("Should copy with new bounds or precision")
        void shouldCopyWithChanges() {
            DistributionParameters base = DistributionParameters.normal(5, 2);

            assertThat(base.withBounds(0.0, 10.0)).isEqualTo(DistributionParameters.normal(5, 2, 0.0, 10.0, null));
            assertThat(base.withPrecision(3)).isEqualTo(DistributionParameters.normal(5, 2, null, null, 3));
            assertThat(base.getPrecision()).isNull();
        }
    }

    @Nested
    @DisplayName("Combination")
    class Combination {

        @Test
        @DisplayName("Should widen the bounds, raise the precision and average the shape")
        void shouldCombineSameKind() {
            // Given
            DistributionParameters first = DistributionParameters.normal(0, 1, -1.0, 1.0, 2);
            DistributionParameters second = DistributionParameters.normal(2, 3, -5.0, 0.5, null);

            // When
            DistributionParameters combined = first.combine(second);

            // Then
            assertThat(combined).isEqualTo(DistributionParameters.normal(1, 2, -5.0, 1.0, 2));
        }

        @Test
        @DisplayName("Should take a bound present on one side only")
        void shouldTakeOneSidedBound() {
            DistributionParameters combined = DistributionParameters.normal()
                .combine(DistributionParameters.normal(0, 1, 3.0, null, null));

            assertThat(combined.getMinimum()).isEqualTo(3.0);
            assertThat(combined.getMaximum()).isNull();
        }

        @Test
        @DisplayName("Should keep the kind with the higher index and its shape")
        void shouldPreferHigherKind() {
            DistributionParameters combined = DistributionParameters.exponential(2)
                .combine(DistributionParameters.normal(5, 1));

            assertThat(combined.getKind()).isEqualTo(DistributionKind.NORMAL);
            assertThat(combined.getShapeParameters()).containsExactly(5.0, 1.0);
        }

        @Test
        @DisplayName("Should pad the shorter weight list with zeros")
        void shouldPadCategoricalWeights() {
            DistributionParameters combined = DistributionParameters.categorical(1, 1)
                .combine(DistributionParameters.categorical(0.2, 0.3, 0.5));

            assertThat(combined.getShapeParameters())
                .containsExactly(new double[] {0.35, 0.4, 0.25}, within(1e-12));
        }
    }

    @Test
    @DisplayName("Should describe the default as continuous uniform over [0, 1)")
    void shouldDescribeDefault() {
        assertThat(DistributionParameters.DEFAULT.getKind()).isEqualTo(DistributionKind.CONTINUOUS_UNIFORM);
        assertThat(DistributionParameters.DEFAULT.getMinimum()).isEqualTo(0.0);
        assertThat(DistributionParameters.DEFAULT.getMaximum()).isEqualTo(1.0);
        assertThat(DistributionParameters.DEFAULT).isEqualTo(DistributionParameters.continuousUniform());
    }
}
