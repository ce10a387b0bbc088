package com.qf2.trader.analytics;

public record PerformanceMetrics(
        double totalReturn,
        double annualReturn,
        double annualVolatility,
        double sharpeRatio,
        double sortinoRatio,
        double maxDrawdown,
        double calmarRatio,
        double valueAtRisk95,
        double conditionalValueAtRisk95
) {
    public static PerformanceMetrics empty() {
        return new PerformanceMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
