package com.qf2.trader.model;

import java.time.Instant;

public record HoldingSnapshot(
        String asset,
        double quantity,
        double avgEntryPrice,
        Instant entryTime,
        double realizedPnl
) {}
