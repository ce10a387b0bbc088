package com.qf2.trader.compliance;

import lombok.With;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-asset wash-trading state derived from fills.
 *
 * @param avgEntryPrice  weighted-average entry of the open quantity; 0 when unknown
 * @param tradeDay       day {@code tradesToday} refers to
 * @param realizedNetPnl realised P&L net of commissions across round trips
 */
@With
public record AssetComplianceState(
        String asset,
        Instant lastBuyTime,
        Instant lastSellTime,
        double heldQuantity,
        double avgEntryPrice,
        LocalDate tradeDay,
        int tradesToday,
        double realizedNetPnl
) {
    public static AssetComplianceState empty(String asset) {
        return new AssetComplianceState(asset, null, null, 0.0, 0.0, null, 0, 0.0);
    }

    public int tradesOn(LocalDate day) {
        return day.equals(tradeDay) ? tradesToday : 0;
    }

    public boolean hasBasis() {
        return avgEntryPrice > 0;
    }
}
