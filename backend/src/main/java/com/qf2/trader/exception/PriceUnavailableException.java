package com.qf2.trader.exception;

import java.util.Map;

public class PriceUnavailableException extends TradingException {

    private final String asset;

    public PriceUnavailableException(String asset, String reason) {
        super("Price unavailable for " + asset + ": " + reason,
                Map.of("asset", asset, "stage", "PRICE_DISCOVERY", "reason", reason));
        this.asset = asset;
    }

    public String getAsset() {
        return asset;
    }
}
