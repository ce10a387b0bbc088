package com.qf2.trader.selection;

public record AlphaConfig(
        int shortWindow,
        int longWindow,
        int meanReversionWindow,
        double meanReversionScale,
        double momentumWeight,
        double sentimentWeight,
        double meanReversionWeight,
        Normalization normalization,
        double zClip
) {
    public enum Normalization {
        MIN_MAX,
        Z_SCORE
    }

    public AlphaConfig {
        if (shortWindow <= 0 || longWindow <= shortWindow) {
            throw new IllegalArgumentException("longWindow must exceed shortWindow > 0");
        }
    }

    /**
     * Bars needed before every sub-signal can be computed.
     */
    public int requiredBars() {
        return Math.max(longWindow, meanReversionWindow) + 1;
    }
}
