package com.qf2.trader.selection;

/**
 * Constraint strength tuning. {@code penaltyOverride}, when set, is used verbatim.
 */
public record HamiltonianConfig(
        double penaltyMultiplier,
        double minPenalty,
        Double penaltyOverride
) {
    public HamiltonianConfig {
        if (penaltyMultiplier <= 1.0) {
            throw new IllegalArgumentException("penaltyMultiplier must be greater than 1");
        }
    }
}
