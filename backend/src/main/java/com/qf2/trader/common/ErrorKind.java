package com.qf2.trader.common;

public enum ErrorKind {
    TRANSIENT,
    TIMEOUT,
    REJECTED,
    UNAVAILABLE,
    INTERRUPTED
}
