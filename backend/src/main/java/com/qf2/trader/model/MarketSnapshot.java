package com.qf2.trader.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bars per asset for one cycle. Immutable once built; assets are kept in sorted order so that
 * every downstream vector has the same, reproducible index order.
 */
public final class MarketSnapshot {

    private final Instant asOf;
    private final Map<String, List<Candle>> bars;

    public MarketSnapshot(Instant asOf, Map<String, List<Candle>> bars) {
        this.asOf = asOf;
        TreeMap<String, List<Candle>> copy = new TreeMap<>();
        bars.forEach((asset, series) -> copy.put(asset, List.copyOf(series)));
        this.bars = Collections.unmodifiableMap(copy);
    }

    public Instant asOf() {
        return asOf;
    }

    public List<String> assets() {
        return List.copyOf(bars.keySet());
    }

    public List<Candle> bars(String asset) {
        return bars.getOrDefault(asset, List.of());
    }

    public int size(String asset) {
        return bars(asset).size();
    }

    public double[] closes(String asset) {
        List<Candle> series = bars(asset);
        double[] closes = new double[series.size()];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = series.get(i).close();
        }
        return closes;
    }

    /**
     * Restricts the snapshot to assets with at least {@code minBars} bars and trims every series
     * to the common tail length.
     */
    public MarketSnapshot eligible(int minBars) {
        List<String> kept = new ArrayList<>();
        int common = Integer.MAX_VALUE;
        for (Map.Entry<String, List<Candle>> entry : bars.entrySet()) {
            if (entry.getValue().size() >= minBars) {
                kept.add(entry.getKey());
                common = Math.min(common, entry.getValue().size());
            }
        }
        Map<String, List<Candle>> aligned = new TreeMap<>();
        for (String asset : kept) {
            List<Candle> series = bars.get(asset);
            aligned.put(asset, series.subList(series.size() - common, series.size()));
        }
        return new MarketSnapshot(asOf, aligned);
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }
}
