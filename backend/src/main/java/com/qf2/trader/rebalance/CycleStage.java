package com.qf2.trader.rebalance;

public enum CycleStage {
    PRICE_DISCOVERY,
    VALUATION,
    DELTA,
    COMPLIANCE,
    SELL_EXECUTION,
    CASH_RESYNC,
    BUY_EXECUTION;

    /**
     * Aborting is allowed only on the boundaries before the sell stage starts.
     */
    public boolean abortableAfter() {
        return ordinal() < SELL_EXECUTION.ordinal();
    }
}
