package com.fleet.diagnostics.engine.indicator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WindowStatisticsTest {

    @Test
    void mean_subRange_usesOnlyThatRange() {
        double[] values = {100.0, 1.0, 2.0, 3.0, 100.0};
        assertThat(WindowStatistics.mean(values, 1, 4)).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void sampleVariance_usesNMinusOneDenominator() {
        double[] values = {2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0};
        // Sum of squared deviations from 5 is 32
        assertThat(WindowStatistics.sampleVariance(values, 0, values.length)).isCloseTo(32.0 / 7.0, within(1e-12));
    }

    @Test
    void sampleVariance_constantRange_isExactlyZero() {
        double[] values = {518.67, 518.67, 518.67, 518.67};
        assertThat(WindowStatistics.sampleVariance(values, 0, 4)).isEqualTo(0.0);
    }

    @Test
    void sampleVariance_singleElement_isZero() {
        assertThat(WindowStatistics.sampleVariance(new double[]{3.0}, 0, 1)).isEqualTo(0.0);
    }

    @Test
    void olsSlope_exactLine_recoversSlope() {
        double[] x = {0.0, 1.0, 2.0, 3.0, 4.0};
        double[] y = {1.0, 3.5, 6.0, 8.5, 11.0};
        assertThat(WindowStatistics.olsSlope(x, y, 0, 5)).isCloseTo(2.5, within(1e-12));
    }

    @Test
    void olsSlope_constantX_isZero() {
        double[] x = {1.0, 1.0, 1.0};
        double[] y = {1.0, 2.0, 3.0};
        assertThat(WindowStatistics.olsSlope(x, y, 0, 3)).isEqualTo(0.0);
    }

    @Test
    void mean_rangeOutsideArray_throws() {
        assertThatThrownBy(() -> WindowStatistics.mean(new double[3], 1, 4))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid window");
    }
}
