package com.meridian.backend.service.feature;

/**
 * Guarded arithmetic for feature computation. Every helper returns the neutral value
 * 0.0 instead of NaN or infinity when its input is degenerate.
 */
final class FeatureMath {

    private FeatureMath() {
    }

    static double safeDiv(double numerator, double denominator) {
        if (denominator == 0.0 || !Double.isFinite(denominator)) {
            return 0.0;
        }
        double result = numerator / denominator;
        return Double.isFinite(result) ? result : 0.0;
    }

    static double relative(double value, double reference) {
        if (Double.isNaN(reference) || reference <= 0.0) {
            return 0.0;
        }
        return value / reference - 1.0;
    }

    static double logReturn(double from, double to) {
        if (from <= 0.0 || to <= 0.0) {
            return 0.0;
        }
        return Math.log(to / from);
    }

    static double mean(double[] values, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    /**
     * Sample standard deviation of {@code values[from, to)}.
     */
    static double stdDev(double[] values, int from, int to) {
        int n = to - from;
        if (n < 2) {
            return 0.0;
        }
        double mean = mean(values, from, to);
        double sumSq = 0.0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            sumSq += diff * diff;
        }
        return Math.sqrt(sumSq / (n - 1));
    }

    /**
     * Least-squares slope of {@code values[from, to)} against its index.
     */
    static double slope(double[] values, int from, int to) {
        int n = to - from;
        if (n < 2) {
            return 0.0;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = mean(values, from, to);
        double covariance = 0.0;
        double varianceX = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            covariance += dx * (values[from + i] - meanY);
            varianceX += dx * dx;
        }
        return safeDiv(covariance, varianceX);
    }

    static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
