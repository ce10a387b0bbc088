package com.qf2.trader.rebalance;

/**
 * @param latch when true a trip holds until {@link CircuitBreakerService#reset()}, otherwise it is
 *              re-evaluated on the next cycle
 */
public record CircuitBreakerConfig(
        double maxDrawdownPct,
        double maxLossRate,
        int minClosedTrades,
        boolean latch
) {}
