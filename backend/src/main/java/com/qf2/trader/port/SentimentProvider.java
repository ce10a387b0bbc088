package com.qf2.trader.port;

import java.util.Collection;
import java.util.Map;

public interface SentimentProvider {

    /**
     * Scores in [-1, 1]; assets without data are simply absent from the map.
     */
    Map<String, Double> getScores(Collection<String> assets);
}
