package com.qf2.trader.compliance;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Anti-wash-trading thresholds. Daily counters roll over at midnight in {@code zone}.
 */
public record ComplianceConfig(
        Duration minHold,
        double minNetProfit,
        int maxDailyTradesPerAsset,
        int maxDailyTotalTrades,
        double minTradeValue,
        double commissionRate,
        Duration cooldownAfterSell,
        ZoneId zone
) {
    public ComplianceConfig {
        if (minHold.isNegative() || cooldownAfterSell.isNegative()) {
            throw new IllegalArgumentException("durations must not be negative");
        }
        if (maxDailyTradesPerAsset < 1 || maxDailyTotalTrades < 1) {
            throw new IllegalArgumentException("daily trade caps must be positive");
        }
    }

    public static ComplianceConfig ofHours(double minHoldHours, double minNetProfit, int maxDailyTradesPerAsset,
                                           int maxDailyTotalTrades, double minTradeValue, double commissionRate,
                                           double cooldownHoursAfterSell, ZoneId zone) {
        return new ComplianceConfig(hours(minHoldHours), minNetProfit, maxDailyTradesPerAsset, maxDailyTotalTrades,
                minTradeValue, commissionRate, hours(cooldownHoursAfterSell), zone);
    }

    private static Duration hours(double hours) {
        return Duration.ofMillis(Math.round(hours * 3_600_000d));
    }
}
