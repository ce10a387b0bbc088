package com.qf2.trader.rebalance;

import com.qf2.trader.exception.CircuitBreakerTrippedException;
import com.qf2.trader.service.TradingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Halts order submission when drawdown from peak equity or the loss rate of closed trades goes
 * beyond its limit. A latched trip stays until {@link #reset()}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CircuitBreakerService {

    public static final String MAX_DRAWDOWN = "MAX_DRAWDOWN";
    public static final String MAX_LOSS_RATE = "MAX_LOSS_RATE";

    private final CircuitBreakerConfig config;
    private final TradingMetrics metrics;
    private final Clock clock;

    private double peakEquity;
    private double lastEquity;
    private int closedTrades;
    private int losingTrades;
    private boolean tripped;
    private String reason;
    private Instant trippedAt;

    /**
     * Called at the start of a cycle; a non-latching breaker clears here and is re-evaluated.
     */
    public synchronized void beginCycle() {
        if (tripped && !config.latch()) {
            log.info("Circuit breaker ({}) cleared for new cycle", reason);
            clear();
        }
    }

    /**
     * @return true when this update tripped the breaker
     */
    public synchronized boolean updateEquity(double equity) {
        lastEquity = equity;
        peakEquity = Math.max(peakEquity, equity);
        double drawdown = drawdown();
        if (drawdown > config.maxDrawdownPct()) {
            return trip(MAX_DRAWDOWN);
        }
        return false;
    }

    /**
     * @return true when this trade tripped the breaker
     */
    public synchronized boolean recordClosedTrade(double realizedPnl) {
        closedTrades++;
        if (realizedPnl < 0) {
            losingTrades++;
        }
        if (closedTrades >= config.minClosedTrades() && lossRate() > config.maxLossRate()) {
            return trip(MAX_LOSS_RATE);
        }
        return false;
    }

    public synchronized void ensureClosed() {
        if (tripped) {
            throw new CircuitBreakerTrippedException(reason, context());
        }
    }

    public synchronized boolean isTripped() {
        return tripped;
    }

    public synchronized void reset() {
        log.warn("Circuit breaker manually reset (was {})", tripped ? reason : "closed");
        clear();
        peakEquity = lastEquity;
        closedTrades = 0;
        losingTrades = 0;
    }

    public synchronized CircuitBreakerState state() {
        return new CircuitBreakerState(tripped, reason, trippedAt, peakEquity, drawdown(), closedTrades, lossRate());
    }

    public synchronized Map<String, Object> context() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("reason", reason);
        context.put("peakEquity", peakEquity);
        context.put("equity", lastEquity);
        context.put("drawdown", drawdown());
        context.put("maxDrawdownPct", config.maxDrawdownPct());
        context.put("closedTrades", closedTrades);
        context.put("lossRate", lossRate());
        context.put("maxLossRate", config.maxLossRate());
        return context;
    }

    private boolean trip(String tripReason) {
        if (tripped) {
            return false;
        }
        tripped = true;
        reason = tripReason;
        trippedAt = clock.instant();
        metrics.recordCircuitBreakerTrip();
        log.error("Circuit breaker tripped: {} {}", tripReason, context());
        return true;
    }

    private void clear() {
        tripped = false;
        reason = null;
        trippedAt = null;
    }

    private double drawdown() {
        return peakEquity > 0 ? (peakEquity - lastEquity) / peakEquity : 0.0;
    }

    private double lossRate() {
        return closedTrades > 0 ? losingTrades / (double) closedTrades : 0.0;
    }
}
