package com.qf2.trader.rebalance;

import java.util.Map;

public record StageOutcome(CycleStage stage, Status status, Map<String, Object> detail) {

    public enum Status {
        COMPLETED,
        PARTIAL,
        SKIPPED,
        FAILED
    }

    public StageOutcome {
        detail = detail == null ? Map.of() : Map.copyOf(detail);
    }
}
