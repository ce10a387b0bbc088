package com.qf2.trader.selection;

import com.qf2.trader.analytics.Stats;
import com.qf2.trader.model.MarketSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class CorrelationEstimator {

    private final CorrelationConfig config;

    /**
     * Pearson correlation of the last {@code lookback} returns. Pairs where either series has zero
     * variance get 0.
     */
    public CorrelationMatrix estimate(MarketSnapshot snapshot) {
        List<String> assets = snapshot.assets();
        int size = assets.size();
        double[][] returns = new double[size][];
        for (int i = 0; i < size; i++) {
            returns[i] = Stats.tail(Stats.returns(snapshot.closes(assets.get(i))), config.lookback());
        }
        double[][] matrix = new double[size][size];
        for (int i = 0; i < size; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < size; j++) {
                double rho = Stats.correlation(returns[i], returns[j]);
                matrix[i][j] = rho;
                matrix[j][i] = rho;
            }
        }
        return new CorrelationMatrix(assets, matrix);
    }
}
