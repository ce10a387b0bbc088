package com.qf2.trader.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Append-only log entry for one confirmed fill.
 */
@Builder
public record TradeRecord(
        String orderId,
        String asset,
        Side side,
        double quantity,
        double price,
        Instant timestamp,
        double commission,
        double realizedPnl,
        HoldingSnapshot holdingAfter
) {
    public double notional() {
        return quantity * price;
    }
}
