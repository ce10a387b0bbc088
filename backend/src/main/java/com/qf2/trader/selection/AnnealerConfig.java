package com.qf2.trader.selection;

/**
 * Simulated annealing schedule: {@code steps} temperatures from {@code tStart} down to
 * {@code tEnd}, {@code sweeps} single-bit proposals per temperature (0 means one per variable),
 * {@code reads} independent runs.
 */
public record AnnealerConfig(
        double tStart,
        double tEnd,
        int steps,
        int sweeps,
        int reads,
        long maxIterations,
        Long seed,
        boolean scaleToProblem,
        int parallelism,
        int sizeTolerance
) {
    public AnnealerConfig {
        if (tStart <= 0 || tEnd <= 0 || tEnd > tStart) {
            throw new IllegalArgumentException("require 0 < tEnd <= tStart");
        }
        if (steps < 1 || reads < 1 || maxIterations < 1) {
            throw new IllegalArgumentException("steps, reads and maxIterations must be positive");
        }
    }

    public AnnealerConfig withSeed(Long newSeed) {
        return new AnnealerConfig(tStart, tEnd, steps, sweeps, reads, maxIterations, newSeed,
                scaleToProblem, parallelism, sizeTolerance);
    }
}
