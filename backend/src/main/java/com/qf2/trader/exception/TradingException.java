package com.qf2.trader.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the trading error taxonomy. The context map carries the asset, stage and numeric
 * inputs that led to the failure so the decision can be rebuilt from the logs alone.
 */
public class TradingException extends RuntimeException {

    private final Map<String, Object> context;

    public TradingException(String message) {
        this(message, Map.of(), null);
    }

    public TradingException(String message, Throwable cause) {
        this(message, Map.of(), cause);
    }

    public TradingException(String message, Map<String, Object> context) {
        this(message, context, null);
    }

    public TradingException(String message, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.context = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public Map<String, Object> getContext() {
        return context;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + getMessage() + (context.isEmpty() ? "" : " " + context);
    }
}
