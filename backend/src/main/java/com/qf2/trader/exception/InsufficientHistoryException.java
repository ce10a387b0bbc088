package com.qf2.trader.exception;

import java.util.Map;

public class InsufficientHistoryException extends TradingException {

    private final int required;
    private final int available;

    public InsufficientHistoryException(String scope, int required, int available) {
        super("Insufficient history for " + scope + ": required " + required + ", available " + available,
                Map.of("scope", scope, "required", required, "available", available));
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
