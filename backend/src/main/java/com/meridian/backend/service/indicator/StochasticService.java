package com.meridian.backend.service.indicator;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Slow stochastic %K/%D plus Williams %R over the same lookback.
 */
@Service
@RequiredArgsConstructor
public class StochasticService {

    private final FeatureProperties featureProperties;

    public StochasticResult calculate(List<Candle> candles) {
        FeatureProperties.Stochastic config = featureProperties.getStochastic();
        int period = config.getPeriod();
        int smoothing = config.getSmoothing();
        if (candles == null || candles.size() < period + smoothing - 1) {
            return new StochasticResult(50.0, 50.0, -50.0, false);
        }

        double[] rawK = new double[smoothing];
        double williams = -50.0;
        for (int s = 0; s < smoothing; s++) {
            int end = candles.size() - smoothing + s;
            double highest = Double.NEGATIVE_INFINITY;
            double lowest = Double.POSITIVE_INFINITY;
            for (int i = end - period + 1; i <= end; i++) {
                highest = Math.max(highest, candles.get(i).getHigh());
                lowest = Math.min(lowest, candles.get(i).getLow());
            }
            double close = candles.get(end).getClose();
            double range = highest - lowest;
            rawK[s] = range > 0 ? 100.0 * (close - lowest) / range : 50.0;
            if (s == smoothing - 1) {
                williams = range > 0 ? -100.0 * (highest - close) / range : -50.0;
            }
        }
        double k = rawK[smoothing - 1];
        double d = 0.0;
        for (double value : rawK) {
            d += value;
        }
        d /= smoothing;
        return new StochasticResult(k, d, williams, true);
    }

    public record StochasticResult(double percentK, double percentD, double williamsR, boolean ready) {}
}
