package com.hsbc.randomize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("NumberTolerance Tests")
class NumberToleranceTest {

    @Test
    @DisplayName("Should treat values within the epsilon as zero")
    void shouldDetectNearlyZero() {
        assertThat(NumberTolerance.isNearlyZero(0.0)).isTrue();
        assertThat(NumberTolerance.isNearlyZero(-1e-16)).isTrue();
        assertThat(NumberTolerance.isNearlyZero(1e-10)).isFalse();
        assertThat(NumberTolerance.isNearlyZero(Double.NaN)).isFalse();
    }

    @Test
    @DisplayName("Should compare absolutely near zero and relatively elsewhere")
    void shouldDetectNearlyEqual() {
        assertThat(NumberTolerance.isNearlyEqual(3.5, 3.5)).isTrue();
        assertThat(NumberTolerance.isNearlyEqual(1e20, Math.nextUp(1e20))).isTrue();
        assertThat(NumberTolerance.isNearlyEqual(0.0, 5e-16)).isTrue();
        assertThat(NumberTolerance.isNearlyEqual(1.0, 1.0001)).isFalse();
        assertThat(NumberTolerance.isNearlyEqual(Double.NaN, Double.NaN)).isFalse();
    }

    @Test
    @DisplayName("Should raise non-positive values to the epsilon but keep NaN")
    void shouldClampToNearlyZero() {
        assertThat(NumberTolerance.atLeastNearlyZero(-3.0)).isEqualTo(NumberTolerance.NEARLY_ZERO);
        assertThat(NumberTolerance.atLeastNearlyZero(0.0)).isEqualTo(NumberTolerance.NEARLY_ZERO);
        assertThat(NumberTolerance.atLeastNearlyZero(2.0)).isEqualTo(2.0);
        assertThat(NumberTolerance.atLeastNearlyZero(Double.NaN)).isNaN();
        assertThat(NumberTolerance.atLeastNearlyZero(Double.POSITIVE_INFINITY)).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    @DisplayName("Should produce seeds from the system seed source")
    void shouldProduceSystemSeeds() {
        assertThatNoException().isThrownBy(SystemSeedSource.INSTANCE::nextSeed);
    }
}
