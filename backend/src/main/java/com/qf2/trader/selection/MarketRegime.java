package com.qf2.trader.selection;

public enum MarketRegime {
    LOW_VOLATILITY,
    NORMAL,
    HIGH_VOLATILITY
}
