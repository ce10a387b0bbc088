package com.qf2.trader.exception;

import java.util.Map;

public class EmptyUniverseException extends TradingException {

    public EmptyUniverseException(int eligible, int targetSize) {
        super("Universe has " + eligible + " eligible assets, fewer than target size " + targetSize,
                Map.of("stage", "SELECTION", "eligible", eligible, "targetSize", targetSize));
    }
}
