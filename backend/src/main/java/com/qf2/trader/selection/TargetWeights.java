package com.qf2.trader.selection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weight per universe asset; zero for every asset outside the selection.
 *
 * @param cvar portfolio CVaR of the returned weights as a positive loss, NaN when not computed
 */
public record TargetWeights(Map<String, Double> weights, Method method, double cvar) {

    public enum Method {
        CVAR_OPTIMIZED,
        SINGLE_ASSET,
        EQUAL_WEIGHT_SHORT_HISTORY,
        EQUAL_WEIGHT_FALLBACK
    }

    public TargetWeights {
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public static TargetWeights equal(List<String> universe, List<String> selected, Method method) {
        Map<String, Double> weights = new LinkedHashMap<>();
        double each = selected.isEmpty() ? 0.0 : 1.0 / selected.size();
        for (String asset : universe) {
            weights.put(asset, selected.contains(asset) ? each : 0.0);
        }
        return new TargetWeights(weights, method, Double.NaN);
    }

    public double weight(String asset) {
        return weights.getOrDefault(asset, 0.0);
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
