package com.qf2.trader.adapter;

import com.qf2.trader.port.SentimentProvider;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySentimentProvider implements SentimentProvider {

    private final Map<String, Double> scores = new ConcurrentHashMap<>();

    public void put(String asset, double score) {
        scores.put(asset, Math.max(-1.0, Math.min(1.0, score)));
    }

    public void remove(String asset) {
        scores.remove(asset);
    }

    @Override
    public Map<String, Double> getScores(Collection<String> assets) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (String asset : assets) {
            Double score = scores.get(asset);
            if (score != null) {
                result.put(asset, score);
            }
        }
        return result;
    }
}
