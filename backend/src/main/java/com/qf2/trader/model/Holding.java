package com.qf2.trader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-asset position. Mutated only by the rebalance orchestrator after a confirmed fill.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Holding {
    private String asset;
    private double quantity;
    private double avgEntryPrice;
    private Instant entryTime;
    private double realizedPnl;
    private Instant updatedAt;

    public boolean hasBasis() {
        return avgEntryPrice > 0;
    }

    public double costBasis() {
        return quantity * avgEntryPrice;
    }

    public double unrealizedPnl(double price) {
        return hasBasis() ? (price - avgEntryPrice) * quantity : 0.0;
    }

    public HoldingSnapshot snapshot() {
        return new HoldingSnapshot(asset, quantity, avgEntryPrice, entryTime, realizedPnl);
    }
}
