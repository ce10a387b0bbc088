package com.qf2.trader.compliance;

import com.qf2.trader.model.Side;

public record ProposedTrade(String asset, Side side, double quantity, double price) {

    public double notional() {
        return quantity * price;
    }
}
