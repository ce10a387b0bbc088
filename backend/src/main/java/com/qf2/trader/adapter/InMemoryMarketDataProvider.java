package com.qf2.trader.adapter;

import com.qf2.trader.exception.PriceUnavailableException;
import com.qf2.trader.model.Candle;
import com.qf2.trader.port.MarketDataProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bars pushed in by the ingestion side. The latest price is the last close unless a live quote has
 * been set.
 */
public class InMemoryMarketDataProvider implements MarketDataProvider {

    private final Map<String, List<Candle>> bars = new ConcurrentHashMap<>();
    private final Map<String, Double> quotes = new ConcurrentHashMap<>();

    public void putBars(String asset, List<Candle> series) {
        bars.put(asset, List.copyOf(series));
    }

    public void append(String asset, Candle candle) {
        bars.compute(asset, (key, existing) -> {
            List<Candle> next = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            next.add(candle);
            return List.copyOf(next);
        });
    }

    public void setQuote(String asset, double price) {
        quotes.put(asset, price);
    }

    public void clearQuote(String asset) {
        quotes.remove(asset);
    }

    public Set<String> assets() {
        return new TreeSet<>(bars.keySet());
    }

    @Override
    public List<Candle> getLatestBars(String asset, int count) {
        List<Candle> series = bars.getOrDefault(asset, List.of());
        if (count >= series.size()) {
            return series;
        }
        return series.subList(series.size() - count, series.size());
    }

    @Override
    public double getLatestPrice(String asset) {
        Double quote = quotes.get(asset);
        if (quote != null) {
            return quote;
        }
        List<Candle> series = bars.get(asset);
        if (series == null || series.isEmpty()) {
            throw new PriceUnavailableException(asset, "no bars");
        }
        return series.get(series.size() - 1).close();
    }
}
