package com.qf2.trader.service;

import com.qf2.trader.rebalance.RebalanceResult;
import com.qf2.trader.selection.SelectionOutcome;

import java.time.Instant;

public record CycleReport(
        String cycleId,
        String trigger,
        Instant startedAt,
        Instant finishedAt,
        CycleStatus status,
        String message,
        SelectionOutcome selection,
        RebalanceResult rebalance
) {}
