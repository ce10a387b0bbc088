package com.qf2.trader.exception;

import java.util.Map;

public class OrderRejectedException extends TradingException {

    public OrderRejectedException(String asset, String reason) {
        super("Order rejected for " + asset + ": " + reason, Map.of("asset", asset, "reason", reason));
    }
}
