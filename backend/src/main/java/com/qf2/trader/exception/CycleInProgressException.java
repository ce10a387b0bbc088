package com.qf2.trader.exception;

import java.util.Map;

public class CycleInProgressException extends TradingException {

    public CycleInProgressException(String runningCycleId) {
        super("Cycle " + runningCycleId + " is still running", Map.of("runningCycleId", runningCycleId));
    }
}
