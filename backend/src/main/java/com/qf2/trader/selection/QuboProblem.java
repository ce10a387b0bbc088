package com.qf2.trader.selection;

import java.util.List;

/**
 * Upper-triangular QUBO over the universe: {@code E(x) = offset + sum_i Q_ii x_i + sum_{i<j} Q_ij x_i x_j}.
 * The couplings are stored symmetrically so a flip delta can be read off a local field. The
 * per-asset alpha and the risk weight are kept alongside so that repair can score the objective
 * without the size penalty.
 */
public final class QuboProblem {

    private final List<String> assets;
    private final double[] linear;
    private final double[][] coupling;
    private final double offset;
    private final double penalty;
    private final int targetSize;
    private final double lambda;
    private final double[] alpha;
    private final double[][] correlation;

    QuboProblem(List<String> assets, double[] linear, double[][] coupling, double offset, double penalty,
                int targetSize, double lambda, double[] alpha, double[][] correlation) {
        this.assets = List.copyOf(assets);
        this.linear = linear;
        this.coupling = coupling;
        this.offset = offset;
        this.penalty = penalty;
        this.targetSize = targetSize;
        this.lambda = lambda;
        this.alpha = alpha;
        this.correlation = correlation;
    }

    public List<String> assets() {
        return assets;
    }

    public int size() {
        return linear.length;
    }

    public double diagonal(int i) {
        return linear[i];
    }

    /**
     * Coefficient of {@code x_i x_j} for {@code i != j}; symmetric.
     */
    public double coupling(int i, int j) {
        return i == j ? 0.0 : coupling[i][j];
    }

    public double offset() {
        return offset;
    }

    public double penalty() {
        return penalty;
    }

    public int targetSize() {
        return targetSize;
    }

    public double lambda() {
        return lambda;
    }

    public double alpha(int i) {
        return alpha[i];
    }

    public double correlation(int i, int j) {
        return correlation[i][j];
    }

    public double energy(boolean[] state) {
        double energy = offset;
        for (int i = 0; i < state.length; i++) {
            if (!state[i]) {
                continue;
            }
            energy += linear[i];
            for (int j = i + 1; j < state.length; j++) {
                if (state[j]) {
                    energy += coupling[i][j];
                }
            }
        }
        return energy;
    }

    /**
     * Reward and risk terms only: {@code -sum alpha_i x_i + lambda sum_{i<j} rho_ij x_i x_j}.
     */
    public double objective(boolean[] state) {
        double value = 0.0;
        for (int i = 0; i < state.length; i++) {
            if (!state[i]) {
                continue;
            }
            value -= alpha[i];
            for (int j = i + 1; j < state.length; j++) {
                if (state[j]) {
                    value += lambda * correlation[i][j];
                }
            }
        }
        return value;
    }

    /**
     * {@code h_i = Q_ii + sum_{j != i} Q_ij x_j}; flipping bit {@code i} changes the energy by
     * {@code (1 - 2 x_i) h_i}.
     */
    public double[] localFields(boolean[] state) {
        double[] fields = new double[linear.length];
        for (int i = 0; i < linear.length; i++) {
            double field = linear[i];
            for (int j = 0; j < linear.length; j++) {
                if (j != i && state[j]) {
                    field += coupling[i][j];
                }
            }
            fields[i] = field;
        }
        return fields;
    }

    /**
     * Magnitude of a single-asset change in the reward and risk terms; used to put annealing
     * temperatures on the problem's own scale.
     */
    public double objectiveScale() {
        double maxAlpha = 0.0;
        double maxRho = 0.0;
        for (int i = 0; i < alpha.length; i++) {
            maxAlpha = Math.max(maxAlpha, Math.abs(alpha[i]));
            for (int j = i + 1; j < alpha.length; j++) {
                maxRho = Math.max(maxRho, Math.abs(correlation[i][j]));
            }
        }
        double scale = maxAlpha + lambda * maxRho;
        return scale > 0 ? scale : 1.0;
    }

    public static int count(boolean[] state) {
        int count = 0;
        for (boolean bit : state) {
            if (bit) {
                count++;
            }
        }
        return count;
    }
}
