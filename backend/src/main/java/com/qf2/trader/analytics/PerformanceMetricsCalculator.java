package com.qf2.trader.analytics;

import java.util.Arrays;

/**
 * Historical performance statistics over a per-period return series.
 */
public class PerformanceMetricsCalculator {

    private final double periodsPerYear;
    private final double riskFreeRate;

    public PerformanceMetricsCalculator(double periodsPerYear, double riskFreeRate) {
        this.periodsPerYear = periodsPerYear;
        this.riskFreeRate = riskFreeRate;
    }

    public PerformanceMetrics calculate(double[] returns) {
        if (returns == null || returns.length == 0) {
            return PerformanceMetrics.empty();
        }
        double totalReturn = Arrays.stream(returns).sum();
        double annualReturn = Stats.mean(returns) * periodsPerYear;
        double annualVolatility = Stats.stdDev(returns) * Math.sqrt(periodsPerYear);
        double sharpe = annualVolatility > 0 ? (annualReturn - riskFreeRate) / annualVolatility : 0.0;

        double[] downside = Arrays.stream(returns).filter(r -> r < 0).toArray();
        double downsideDeviation = downside.length > 0 ? Stats.stdDev(downside) * Math.sqrt(periodsPerYear) : 0.0;
        double sortino = downsideDeviation > 0 ? (annualReturn - riskFreeRate) / downsideDeviation : 0.0;

        double maxDrawdown = maxDrawdown(returns);
        double calmar = maxDrawdown != 0 ? annualReturn / Math.abs(maxDrawdown) : 0.0;

        double var95 = Stats.quantile(returns, 0.05);
        double cvar95 = conditionalValueAtRisk(returns, 0.95);
        return new PerformanceMetrics(totalReturn, annualReturn, annualVolatility, sharpe, sortino,
                maxDrawdown, calmar, var95, cvar95);
    }

    /**
     * Worst peak-to-trough decline of the compounded wealth index, as a non-positive fraction.
     */
    public static double maxDrawdown(double[] returns) {
        double wealth = 1.0;
        double peak = 1.0;
        double worst = 0.0;
        for (double r : returns) {
            wealth *= 1.0 + r;
            peak = Math.max(peak, wealth);
            worst = Math.min(worst, (wealth - peak) / peak);
        }
        return worst;
    }

    /**
     * Mean of the worst {@code (1 - confidence)} share of returns, at least one observation.
     * Returned as a return (negative for losses).
     */
    public static double conditionalValueAtRisk(double[] returns, double confidence) {
        if (returns.length == 0) {
            return 0.0;
        }
        double[] sorted = returns.clone();
        Arrays.sort(sorted);
        int tailCount = Math.max((int) Math.floor((1.0 - confidence) * sorted.length), 1);
        double sum = 0.0;
        for (int i = 0; i < tailCount; i++) {
            sum += sorted[i];
        }
        return sum / tailCount;
    }
}
