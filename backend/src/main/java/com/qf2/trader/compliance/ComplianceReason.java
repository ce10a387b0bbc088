package com.qf2.trader.compliance;

/**
 * Block reasons, declared in evaluation order.
 */
public enum ComplianceReason {
    MIN_HOLD_TIME,
    MIN_NET_PROFIT,
    ASSET_DAILY_LIMIT,
    GLOBAL_DAILY_LIMIT,
    MIN_TRADE_VALUE,
    SELL_COOLDOWN
}
