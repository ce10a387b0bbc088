package com.qf2.trader.selection;

public record LambdaTuningConfig(
        boolean enabled,
        int minCycles,
        int historySize,
        double highVolatilityShare,
        double boost,
        double cap
) {
    public static LambdaTuningConfig disabled() {
        return new LambdaTuningConfig(false, 10, 42, 0.3, 1.5, 1.5);
    }
}
