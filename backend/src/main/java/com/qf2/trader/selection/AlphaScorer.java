package com.qf2.trader.selection;

import com.qf2.trader.analytics.Stats;
import com.qf2.trader.exception.InsufficientHistoryException;
import com.qf2.trader.model.MarketSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Multi-factor alpha: momentum, mean reversion and an external sentiment score, combined by
 * weighted sum and normalised across the universe.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlphaScorer {

    private final AlphaConfig config;

    public AlphaVector score(MarketSnapshot snapshot, Map<String, Double> sentiment) {
        List<String> assets = snapshot.assets();
        double[] raw = new double[assets.size()];
        int missingSentiment = 0;
        for (int i = 0; i < assets.size(); i++) {
            String asset = assets.get(i);
            double[] closes = snapshot.closes(asset);
            if (closes.length < config.requiredBars()) {
                throw new InsufficientHistoryException(asset, config.requiredBars(), closes.length);
            }
            Double score = sentiment == null ? null : sentiment.get(asset);
            if (score == null || !Double.isFinite(score)) {
                missingSentiment++;
                score = 0.0;
            }
            raw[i] = config.momentumWeight() * momentum(closes)
                    + config.sentimentWeight() * Stats.clamp(score, -1.0, 1.0)
                    + config.meanReversionWeight() * meanReversion(closes);
        }
        if (missingSentiment > 0) {
            log.warn("Sentiment missing for {} of {} assets, using neutral score", missingSentiment, assets.size());
        }
        return new AlphaVector(assets, normalize(raw));
    }

    public int requiredBars() {
        return config.requiredBars();
    }

    double momentum(double[] closes) {
        return windowReturn(closes, config.shortWindow()) - windowReturn(closes, config.longWindow());
    }

    double meanReversion(double[] closes) {
        double price = closes[closes.length - 1];
        if (price <= 0) {
            return 0.0;
        }
        double movingAverage = Stats.mean(Stats.tail(closes, config.meanReversionWindow()));
        return config.meanReversionScale() * (movingAverage - price) / price;
    }

    double[] normalize(double[] raw) {
        return switch (config.normalization()) {
            case MIN_MAX -> minMax(raw);
            case Z_SCORE -> zScore(raw);
        };
    }

    private double windowReturn(double[] closes, int window) {
        double past = closes[closes.length - 1 - window];
        return past > 0 ? closes[closes.length - 1] / past - 1.0 : 0.0;
    }

    private double[] minMax(double[] raw) {
        double[] normalized = new double[raw.length];
        if (raw.length == 0) {
            return normalized;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : raw) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double range = max - min;
        if (range <= 0) {
            return normalized;
        }
        for (int i = 0; i < raw.length; i++) {
            normalized[i] = 2.0 * (raw[i] - min) / range - 1.0;
        }
        return normalized;
    }

    private double[] zScore(double[] raw) {
        double[] normalized = new double[raw.length];
        double mean = Stats.mean(raw);
        double std = Stats.stdDev(raw);
        if (std <= 0) {
            return normalized;
        }
        double clip = config.zClip();
        for (int i = 0; i < raw.length; i++) {
            normalized[i] = Stats.clamp((raw[i] - mean) / std, -clip, clip) / clip;
        }
        return normalized;
    }
}
