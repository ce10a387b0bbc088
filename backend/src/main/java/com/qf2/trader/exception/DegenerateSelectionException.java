package com.qf2.trader.exception;

import java.util.Map;

public class DegenerateSelectionException extends TradingException {

    public DegenerateSelectionException(String message, Map<String, Object> context) {
        super(message, context);
    }
}
