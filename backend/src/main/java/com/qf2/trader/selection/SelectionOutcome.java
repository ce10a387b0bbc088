package com.qf2.trader.selection;

import java.util.List;

public record SelectionOutcome(
        RegimeParameters regime,
        AlphaVector alpha,
        double penalty,
        Double annealedEnergy,
        Selection selection,
        TargetWeights weights,
        List<Fallback> fallbacks
) {
    public enum Fallback {
        REGIME_PREVIOUS,
        REGIME_DEFAULTS,
        TOP_ALPHA,
        EQUAL_WEIGHT
    }

    public SelectionOutcome {
        fallbacks = List.copyOf(fallbacks);
    }
}
