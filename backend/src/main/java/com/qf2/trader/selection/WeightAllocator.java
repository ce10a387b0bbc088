package com.qf2.trader.selection;

import com.qf2.trader.analytics.PerformanceMetrics;
import com.qf2.trader.analytics.PerformanceMetricsCalculator;
import com.qf2.trader.analytics.Stats;
import com.qf2.trader.exception.DegenerateSelectionException;
import com.qf2.trader.model.MarketSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CVaR-minimising weights over the selected assets.
 *
 * <p>Minimises {@code CVaR(w) - expectedReturnWeight * mu'w + performancePenalty * sum w_i (1 - q_i)}
 * by projected subgradient descent on the capped simplex {@code minWeight <= w_i <= maxWeight,
 * sum w = 1}, where {@code q_i} in [0, 1] is a quality score from the asset's Sharpe, Sortino and
 * Calmar ratios. The caps are widened to {@code 1/k} when a selection of {@code k} assets cannot
 * satisfy them. The best iterate is returned.
 */
@Slf4j
@Service
public class WeightAllocator {

    private static final int PROJECTION_ITERATIONS = 100;

    private final AllocatorConfig config;
    private final PerformanceMetricsCalculator metricsCalculator;

    public WeightAllocator(AllocatorConfig config) {
        this.config = config;
        this.metricsCalculator = new PerformanceMetricsCalculator(config.periodsPerYear(), 0.0);
    }

    public TargetWeights allocate(Selection selection, MarketSnapshot snapshot) {
        List<String> universe = selection.universe();
        List<String> selected = selection.selectedAssets();
        if (selected.isEmpty()) {
            throw new DegenerateSelectionException("Selection is empty", Map.of("stage", "ALLOCATION"));
        }
        if (selected.size() == 1) {
            return TargetWeights.equal(universe, selected, TargetWeights.Method.SINGLE_ASSET);
        }
        double[][] returns = alignedReturns(selected, snapshot);
        int observations = returns[0].length;
        if (observations < config.minObservations()) {
            log.warn("Only {} aligned returns for {} assets, using equal weights", observations, selected.size());
            return TargetWeights.equal(universe, selected, TargetWeights.Method.EQUAL_WEIGHT_SHORT_HISTORY);
        }
        if (allIdentical(returns)) {
            throw new DegenerateSelectionException("All historical returns are identical",
                    Map.of("stage", "ALLOCATION", "assets", selected, "observations", observations));
        }

        int k = selected.size();
        double lower = Math.min(config.minWeight(), 1.0 / k);
        double upper = Math.max(config.maxWeight(), 1.0 / k);
        double[] mean = new double[k];
        double[] quality = new double[k];
        for (int a = 0; a < k; a++) {
            mean[a] = Stats.mean(returns[a]);
            quality[a] = quality(metricsCalculator.calculate(returns[a]));
        }

        double[] weights = new double[k];
        Arrays.fill(weights, 1.0 / k);
        double[] best = weights.clone();
        double bestObjective = objective(weights, returns, mean, quality);
        for (int iteration = 0; iteration < config.iterations(); iteration++) {
            double[] gradient = subgradient(weights, returns, mean, quality);
            double step = config.stepSize() / Math.sqrt(iteration + 1.0);
            double[] candidate = new double[k];
            for (int a = 0; a < k; a++) {
                candidate[a] = weights[a] - step * gradient[a];
            }
            weights = project(candidate, lower, upper);
            double value = objective(weights, returns, mean, quality);
            if (value < bestObjective) {
                bestObjective = value;
                best = weights.clone();
            }
        }

        double total = 0.0;
        for (int a = 0; a < k; a++) {
            best[a] = Stats.clamp(best[a], 0.0, 1.0);
            total += best[a];
        }
        Map<String, Double> result = new LinkedHashMap<>();
        for (String asset : universe) {
            result.put(asset, 0.0);
        }
        for (int a = 0; a < k; a++) {
            result.put(selected.get(a), best[a] / total);
        }
        double cvar = portfolioCvar(best, returns);
        log.info("CVaR allocation over {} assets: cvar={}, objective={}", k, cvar, bestObjective);
        return new TargetWeights(result, TargetWeights.Method.CVAR_OPTIMIZED, cvar);
    }

    private double[][] alignedReturns(List<String> selected, MarketSnapshot snapshot) {
        double[][] series = new double[selected.size()][];
        int common = Integer.MAX_VALUE;
        for (int a = 0; a < selected.size(); a++) {
            series[a] = Stats.returns(snapshot.closes(selected.get(a)));
            common = Math.min(common, series[a].length);
        }
        for (int a = 0; a < series.length; a++) {
            series[a] = Stats.tail(series[a], common);
        }
        return series;
    }

    private boolean allIdentical(double[][] returns) {
        double first = returns[0][0];
        for (double[] series : returns) {
            for (double value : series) {
                if (value != first) {
                    return false;
                }
            }
        }
        return true;
    }

    private double objective(double[] weights, double[][] returns, double[] mean, double[] quality) {
        double value = portfolioCvar(weights, returns);
        for (int a = 0; a < weights.length; a++) {
            value -= config.expectedReturnWeight() * mean[a] * weights[a];
            value += config.performancePenalty() * weights[a] * (1.0 - quality[a]);
        }
        return value;
    }

    private double portfolioCvar(double[] weights, double[][] returns) {
        return -PerformanceMetricsCalculator.conditionalValueAtRisk(portfolioReturns(weights, returns), config.confidence());
    }

    private double[] subgradient(double[] weights, double[][] returns, double[] mean, double[] quality) {
        double[] portfolio = portfolioReturns(weights, returns);
        Integer[] order = new Integer[portfolio.length];
        for (int t = 0; t < order.length; t++) {
            order[t] = t;
        }
        Arrays.sort(order, (x, y) -> Double.compare(portfolio[x], portfolio[y]));
        int tail = Math.max((int) Math.floor((1.0 - config.confidence()) * portfolio.length), 1);
        double[] gradient = new double[weights.length];
        for (int s = 0; s < tail; s++) {
            int t = order[s];
            for (int a = 0; a < weights.length; a++) {
                gradient[a] -= returns[a][t] / tail;
            }
        }
        for (int a = 0; a < weights.length; a++) {
            gradient[a] += -config.expectedReturnWeight() * mean[a] + config.performancePenalty() * (1.0 - quality[a]);
        }
        return gradient;
    }

    private double[] portfolioReturns(double[] weights, double[][] returns) {
        double[] portfolio = new double[returns[0].length];
        for (int a = 0; a < weights.length; a++) {
            for (int t = 0; t < portfolio.length; t++) {
                portfolio[t] += weights[a] * returns[a][t];
            }
        }
        return portfolio;
    }

    /**
     * Euclidean projection onto {@code {lower <= w_i <= upper, sum w = 1}}: bisection on the shift
     * {@code tau} in {@code w_i = clamp(v_i - tau)}.
     */
    static double[] project(double[] values, double lower, double upper) {
        double low = Double.POSITIVE_INFINITY;
        double high = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            low = Math.min(low, value - upper);
            high = Math.max(high, value - lower);
        }
        for (int i = 0; i < PROJECTION_ITERATIONS; i++) {
            double tau = (low + high) / 2.0;
            double sum = 0.0;
            for (double value : values) {
                sum += Stats.clamp(value - tau, lower, upper);
            }
            if (sum > 1.0) {
                low = tau;
            } else {
                high = tau;
            }
        }
        double tau = (low + high) / 2.0;
        double[] projected = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            projected[i] = Stats.clamp(values[i] - tau, lower, upper);
        }
        return projected;
    }

    private double quality(PerformanceMetrics metrics) {
        return (squash(metrics.sharpeRatio()) + squash(metrics.sortinoRatio()) + squash(metrics.calmarRatio())) / 3.0;
    }

    private double squash(double ratio) {
        if (!Double.isFinite(ratio)) {
            return ratio > 0 ? 1.0 : 0.0;
        }
        return (Math.tanh(ratio / 2.0) + 1.0) / 2.0;
    }
}
