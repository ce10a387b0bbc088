package com.qf2.trader.analytics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PerformanceMetricsCalculatorTest {

    @Test
    void maxDrawdownTracksCompoundedPeakToTrough() {
        double drawdown = PerformanceMetricsCalculator.maxDrawdown(new double[]{0.10, -0.20, 0.05});

        assertThat(drawdown).isCloseTo(-0.20, within(1e-12));
    }

    @Test
    void conditionalValueAtRiskAveragesWorstTail() {
        double[] returns = new double[20];
        for (int i = 0; i < returns.length; i++) {
            returns[i] = (i - 10) / 100.0;
        }

        assertThat(PerformanceMetricsCalculator.conditionalValueAtRisk(returns, 0.95)).isCloseTo(-0.10, within(1e-12));
        assertThat(PerformanceMetricsCalculator.conditionalValueAtRisk(returns, 0.75)).isCloseTo(-0.08, within(1e-12));
    }

    @Test
    void emptySeriesYieldsZeroMetrics() {
        PerformanceMetrics metrics = new PerformanceMetricsCalculator(8760, 0).calculate(new double[0]);

        assertThat(metrics).isEqualTo(PerformanceMetrics.empty());
    }

    @Test
    void risingSeriesHasPositiveRatios() {
        double[] returns = {0.01, 0.02, -0.005, 0.015, 0.01, -0.002};
        PerformanceMetrics metrics = new PerformanceMetricsCalculator(252, 0).calculate(returns);

        assertThat(metrics.sharpeRatio()).isPositive();
        assertThat(metrics.sortinoRatio()).isPositive();
        assertThat(metrics.calmarRatio()).isPositive();
        assertThat(metrics.maxDrawdown()).isNegative();
        assertThat(metrics.conditionalValueAtRisk95()).isCloseTo(-0.005, within(1e-12));
    }
}
