package com.qf2.trader.model;

public enum Side {
    BUY,
    SELL
}
