package com.qf2.trader.selection;

/**
 * Portfolio size {@code n} and risk-penalty weight {@code lambda} for one cycle.
 *
 * @param fallback true when the values were reused from a previous cycle or defaults
 */
public record RegimeParameters(
        int targetSize,
        double lambda,
        double volatility,
        MarketRegime regime,
        boolean fallback
) {
    public RegimeParameters asFallback() {
        return new RegimeParameters(targetSize, lambda, volatility, regime, true);
    }

    public RegimeParameters withLambda(double newLambda) {
        return new RegimeParameters(targetSize, newLambda, volatility, regime, fallback);
    }
}
