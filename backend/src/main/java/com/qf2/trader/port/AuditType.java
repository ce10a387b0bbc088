package com.qf2.trader.port;

public enum AuditType {
    CYCLE_STARTED,
    CYCLE_FINISHED,
    REGIME,
    ALPHA,
    ANNEALING,
    SELECTION,
    WEIGHTS,
    FALLBACK,
    STAGE,
    PRICE_UNAVAILABLE,
    COMPLIANCE_DECISION,
    TRADE_ATTEMPT,
    TRADE_OUTCOME,
    CIRCUIT_BREAKER
}
