package com.qf2.trader.selection;

public record CorrelationConfig(int lookback) {
    public CorrelationConfig {
        if (lookback < 2) {
            throw new IllegalArgumentException("lookback must be at least 2");
        }
    }
}
