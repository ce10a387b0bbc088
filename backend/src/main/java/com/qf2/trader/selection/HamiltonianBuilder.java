package com.qf2.trader.selection;

import com.qf2.trader.exception.EmptyUniverseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Expands {@code H = -sum alpha_i x_i + lambda sum_{i<j} rho_ij x_i x_j + P (sum x_i - n)^2} into QUBO
 * coefficients.
 *
 * <p>The default constraint strength is {@code P = multiplier * (max|alpha| + lambda * n * max|rho|)},
 * floored at {@code minPenalty}. Adding one asset to a selection of {@code k < n} changes the
 * reward and risk terms by at most {@code max|alpha| + lambda * k * max|rho|} while the penalty term
 * drops by at least {@code P}, and the symmetric argument holds for removal above {@code n}. With a
 * multiplier above 1 every single-flip local minimum therefore holds exactly {@code n} assets.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HamiltonianBuilder {

    private final HamiltonianConfig config;

    public QuboProblem build(AlphaVector alpha, CorrelationMatrix correlation, int targetSize, double lambda) {
        return build(alpha, correlation, targetSize, lambda, penaltyFor(alpha, correlation, targetSize, lambda));
    }

    public QuboProblem build(AlphaVector alpha, CorrelationMatrix correlation, int targetSize, double lambda,
                             double penalty) {
        List<String> assets = alpha.assets();
        if (!assets.equals(correlation.assets())) {
            throw new IllegalArgumentException("alpha and correlation cover different universes");
        }
        int size = assets.size();
        if (targetSize < 1 || size < targetSize) {
            throw new EmptyUniverseException(size, targetSize);
        }
        double[] linear = new double[size];
        double[][] coupling = new double[size][size];
        double[] alphas = new double[size];
        double[][] rho = new double[size][size];
        for (int i = 0; i < size; i++) {
            alphas[i] = alpha.score(i);
            linear[i] = -alphas[i] + penalty * (1 - 2.0 * targetSize);
            for (int j = 0; j < size; j++) {
                rho[i][j] = correlation.get(i, j);
                if (j != i) {
                    coupling[i][j] = lambda * correlation.get(i, j) + 2.0 * penalty;
                }
            }
        }
        double offset = penalty * targetSize * (double) targetSize;
        log.debug("QUBO built: {} assets, n={}, lambda={}, P={}", size, targetSize, lambda, penalty);
        return new QuboProblem(assets, linear, coupling, offset, penalty, targetSize, lambda, alphas, rho);
    }

    public double penaltyFor(AlphaVector alpha, CorrelationMatrix correlation, int targetSize, double lambda) {
        if (config.penaltyOverride() != null) {
            return config.penaltyOverride();
        }
        double bound = alpha.maxAbs() + lambda * targetSize * correlation.maxAbsOffDiagonal();
        return Math.max(config.penaltyMultiplier() * bound, config.minPenalty());
    }
}
