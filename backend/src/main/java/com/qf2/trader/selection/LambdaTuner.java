package com.qf2.trader.selection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Raises the risk-penalty weight when recent cycles were dominated by high volatility.
 */
@Slf4j
@Component
public class LambdaTuner {

    private final LambdaTuningConfig config;
    private final Deque<MarketRegime> history = new ArrayDeque<>();

    public LambdaTuner(LambdaTuningConfig config) {
        this.config = config;
    }

    public synchronized void record(MarketRegime regime) {
        history.addLast(regime);
        while (history.size() > Math.max(config.historySize(), 1)) {
            history.removeFirst();
        }
    }

    public synchronized double tune(double lambda) {
        if (!config.enabled() || history.size() < config.minCycles()) {
            return lambda;
        }
        long highVolatility = history.stream().filter(r -> r == MarketRegime.HIGH_VOLATILITY).count();
        double share = highVolatility / (double) history.size();
        if (share <= config.highVolatilityShare()) {
            return lambda;
        }
        double tuned = Math.min(config.cap(), lambda * config.boost());
        if (tuned != lambda) {
            log.info("Lambda tuned from {} to {} (high-volatility share {})", lambda, tuned, share);
        }
        return tuned;
    }

    public synchronized int historySize() {
        return history.size();
    }
}
