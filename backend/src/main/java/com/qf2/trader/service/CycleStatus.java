package com.qf2.trader.service;

public enum CycleStatus {
    COMPLETED,
    ABORTED,
    HALTED,
    EMPTY_UNIVERSE,
    FAILED
}
