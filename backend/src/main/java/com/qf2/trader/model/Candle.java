package com.qf2.trader.model;

import java.time.Instant;

public record Candle(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume
) {
    public static Candle ofClose(Instant timestamp, double close) {
        return new Candle(timestamp, close, close, close, close, 0.0);
    }
}
