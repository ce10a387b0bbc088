package com.qf2.trader.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerResponse {

    private boolean tripped;
    private String reason;
    private Instant trippedAt;
    private double peakEquity;
    private double drawdown;
    private int closedTrades;
    private double lossRate;
}
