package com.qf2.trader.rebalance;

import java.time.Instant;

public record CircuitBreakerState(
        boolean tripped,
        String reason,
        Instant trippedAt,
        double peakEquity,
        double drawdown,
        int closedTrades,
        double lossRate
) {}
