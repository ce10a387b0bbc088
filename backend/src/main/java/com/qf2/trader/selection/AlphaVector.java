package com.qf2.trader.selection;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalised alpha per asset, indexed in the same sorted order as the universe.
 */
public record AlphaVector(List<String> assets, double[] scores) {

    public AlphaVector {
        assets = List.copyOf(assets);
        scores = scores.clone();
        if (assets.size() != scores.length) {
            throw new IllegalArgumentException("assets and scores differ in length");
        }
    }

    public static AlphaVector of(List<String> assets, double... scores) {
        return new AlphaVector(assets, scores);
    }

    @Override
    public double[] scores() {
        return scores.clone();
    }

    public int size() {
        return scores.length;
    }

    public double score(int index) {
        return scores[index];
    }

    public double score(String asset) {
        int index = assets.indexOf(asset);
        return index < 0 ? 0.0 : scores[index];
    }

    public double maxAbs() {
        double max = 0.0;
        for (double score : scores) {
            max = Math.max(max, Math.abs(score));
        }
        return max;
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < scores.length; i++) {
            map.put(assets.get(i), scores[i]);
        }
        return map;
    }
}
