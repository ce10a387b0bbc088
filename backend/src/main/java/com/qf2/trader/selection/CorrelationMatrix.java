package com.qf2.trader.selection;

import java.util.List;

/**
 * Symmetric pairwise correlation over the universe order, unit diagonal.
 */
public final class CorrelationMatrix {

    private final List<String> assets;
    private final double[][] values;

    public CorrelationMatrix(List<String> assets, double[][] values) {
        if (values.length != assets.size()) {
            throw new IllegalArgumentException("matrix size does not match asset count");
        }
        this.assets = List.copyOf(assets);
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            this.values[i] = values[i].clone();
        }
    }

    public static CorrelationMatrix uniform(List<String> assets, double rho) {
        int n = assets.size();
        double[][] values = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                values[i][j] = i == j ? 1.0 : rho;
            }
        }
        return new CorrelationMatrix(assets, values);
    }

    public List<String> assets() {
        return assets;
    }

    public int size() {
        return assets.size();
    }

    public double get(int i, int j) {
        return values[i][j];
    }

    public double get(String a, String b) {
        return values[assets.indexOf(a)][assets.indexOf(b)];
    }

    public double maxAbsOffDiagonal() {
        double max = 0.0;
        for (int i = 0; i < values.length; i++) {
            for (int j = i + 1; j < values.length; j++) {
                max = Math.max(max, Math.abs(values[i][j]));
            }
        }
        return max;
    }
}
