package com.meridian.backend.service.indicator;

import java.util.Arrays;

/**
 * Moving-average helpers over plain arrays. Slots without enough history hold
 * {@link Double#NaN}.
 */
public final class MovingAverages {

    private MovingAverages() {
    }

    public static double sma(double[] values, int period) {
        if (period <= 0 || values.length < period) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (int i = values.length - period; i < values.length; i++) {
            sum += values[i];
        }
        return sum / period;
    }

    /**
     * EMA seeded with the SMA of the first {@code period} values.
     */
    public static double[] emaSeries(double[] values, int period) {
        double[] ema = new double[values.length];
        Arrays.fill(ema, Double.NaN);
        if (period <= 0 || values.length < period) {
            return ema;
        }
        double seed = 0.0;
        for (int i = 0; i < period; i++) {
            seed += values[i];
        }
        seed /= period;
        ema[period - 1] = seed;
        double k = 2.0 / (period + 1);
        for (int i = period; i < values.length; i++) {
            ema[i] = (values[i] * k) + (ema[i - 1] * (1 - k));
        }
        return ema;
    }

    public static double ema(double[] values, int period) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] series = emaSeries(values, period);
        return series[series.length - 1];
    }
}
