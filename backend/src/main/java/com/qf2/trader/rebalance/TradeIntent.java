package com.qf2.trader.rebalance;

import com.qf2.trader.model.Side;

public record TradeIntent(
        String asset,
        Side side,
        double quantity,
        double price,
        double currentWeight,
        double targetWeight
) {
    public double deltaWeight() {
        return targetWeight - currentWeight;
    }

    public double notional() {
        return quantity * price;
    }

    public TradeIntent withQuantity(double newQuantity) {
        return new TradeIntent(asset, side, newQuantity, price, currentWeight, targetWeight);
    }
}
