package com.qf2.trader.selection;

public record AllocatorConfig(
        double confidence,
        double minWeight,
        double maxWeight,
        double expectedReturnWeight,
        double performancePenalty,
        int minObservations,
        int iterations,
        double stepSize,
        double periodsPerYear
) {
    public AllocatorConfig {
        if (confidence <= 0 || confidence >= 1) {
            throw new IllegalArgumentException("confidence must be in (0, 1)");
        }
        if (minWeight < 0 || maxWeight > 1 || minWeight > maxWeight) {
            throw new IllegalArgumentException("require 0 <= minWeight <= maxWeight <= 1");
        }
    }
}
