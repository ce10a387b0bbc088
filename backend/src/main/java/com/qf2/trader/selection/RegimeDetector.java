package com.qf2.trader.selection;

import com.qf2.trader.analytics.Stats;
import com.qf2.trader.exception.InsufficientHistoryException;
import com.qf2.trader.model.MarketSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Maps market-wide volatility to portfolio size and risk-penalty weight. Both mappings are
 * monotonic, piecewise linear between the low and high volatility thresholds and clamped to
 * their configured bounds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegimeDetector {

    private final RegimeConfig config;

    public RegimeParameters detect(MarketSnapshot snapshot, List<String> referenceAssets) {
        List<String> reference = referenceAssets == null || referenceAssets.isEmpty()
                ? snapshot.assets()
                : referenceAssets;
        double volatilitySum = 0.0;
        int counted = 0;
        int bestAvailable = 0;
        for (String asset : reference) {
            double[] returns = Stats.tail(Stats.returns(snapshot.closes(asset)), config.window());
            bestAvailable = Math.max(bestAvailable, returns.length);
            if (returns.length < config.minObservations()) {
                continue;
            }
            volatilitySum += Stats.stdDev(returns);
            counted++;
        }
        if (counted == 0) {
            throw new InsufficientHistoryException("regime reference set", config.minObservations(), bestAvailable);
        }
        double volatility = volatilitySum / counted * Math.sqrt(config.annualizationFactor());
        RegimeParameters parameters = fromVolatility(volatility);
        log.info("Market regime {} (vol: {}) -> n={}, lambda={}", parameters.regime(),
                String.format("%.3f", volatility), parameters.targetSize(), String.format("%.3f", parameters.lambda()));
        return parameters;
    }

    public RegimeParameters fromVolatility(double volatility) {
        double position = Stats.clamp(
                (volatility - config.lowVolatility()) / (config.highVolatility() - config.lowVolatility()), 0.0, 1.0);
        int n = (int) Math.round(config.minAssets() + position * (config.maxAssets() - config.minAssets()));
        double lambda = config.minLambda() + position * (config.maxLambda() - config.minLambda());
        return new RegimeParameters(n, lambda, volatility, classify(volatility), false);
    }

    public RegimeParameters defaults() {
        return new RegimeParameters(config.defaultAssets(), config.defaultLambda(), Double.NaN, MarketRegime.NORMAL, true);
    }

    private MarketRegime classify(double volatility) {
        if (volatility > config.highVolatility()) {
            return MarketRegime.HIGH_VOLATILITY;
        }
        if (volatility < config.lowVolatility()) {
            return MarketRegime.LOW_VOLATILITY;
        }
        return MarketRegime.NORMAL;
    }
}
