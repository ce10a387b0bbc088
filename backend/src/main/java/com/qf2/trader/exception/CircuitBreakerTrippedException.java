package com.qf2.trader.exception;

import java.util.Map;

public class CircuitBreakerTrippedException extends TradingException {

    public CircuitBreakerTrippedException(String reason, Map<String, Object> context) {
        super("Circuit breaker tripped: " + reason, context);
    }
}
