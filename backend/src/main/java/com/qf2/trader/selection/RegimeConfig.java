package com.qf2.trader.selection;

public record RegimeConfig(
        int window,
        int minObservations,
        double annualizationFactor,
        double lowVolatility,
        double highVolatility,
        int minAssets,
        int maxAssets,
        double minLambda,
        double maxLambda,
        int defaultAssets,
        double defaultLambda
) {
    public RegimeConfig {
        if (highVolatility <= lowVolatility) {
            throw new IllegalArgumentException("highVolatility must exceed lowVolatility");
        }
        if (maxAssets < minAssets || maxLambda < minLambda) {
            throw new IllegalArgumentException("max bounds must not be below min bounds");
        }
    }
}
