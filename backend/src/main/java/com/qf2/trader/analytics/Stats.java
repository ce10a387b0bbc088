package com.qf2.trader.analytics;

import java.util.Arrays;

public final class Stats {

    private Stats() {
    }

    /**
     * Simple returns {@code p[t]/p[t-1] - 1}. Non-positive prices yield a zero return for that step.
     */
    public static double[] returns(double[] prices) {
        if (prices.length < 2) {
            return new double[0];
        }
        double[] returns = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            double previous = prices[i - 1];
            returns[i - 1] = previous > 0 ? prices[i] / previous - 1.0 : 0.0;
        }
        return returns;
    }

    public static double[] tail(double[] values, int count) {
        if (count >= values.length) {
            return values.clone();
        }
        return Arrays.copyOfRange(values, values.length - count, values.length);
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation (n - 1 denominator); zero for fewer than two values.
     */
    public static double stdDev(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquares = 0.0;
        for (double value : values) {
            double diff = value - mean;
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares / (values.length - 1));
    }

    public static double correlation(double[] a, double[] b) {
        int n = Math.min(a.length, b.length);
        if (n < 2) {
            return 0.0;
        }
        double[] x = tail(a, n);
        double[] y = tail(b, n);
        double meanX = mean(x);
        double meanY = mean(y);
        double covariance = 0.0;
        double varianceX = 0.0;
        double varianceY = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            covariance += dx * dy;
            varianceX += dx * dx;
            varianceY += dy * dy;
        }
        if (varianceX == 0.0 || varianceY == 0.0) {
            return 0.0;
        }
        double rho = covariance / Math.sqrt(varianceX * varianceY);
        return Math.max(-1.0, Math.min(1.0, rho));
    }

    /**
     * Empirical quantile with linear interpolation between order statistics.
     */
    public static double quantile(double[] values, double q) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
