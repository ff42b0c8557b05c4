package com.meridian.backend.service.indicator;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class RsiService {

    private final FeatureProperties featureProperties;

    public RsiResult calculate(List<Candle> candles) {
        int period = featureProperties.getRsi().getPeriod();
        if (candles == null || candles.size() < period + 1) {
            return new RsiResult(50.0, false);
        }

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss += Math.abs(change);
            }
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < candles.size(); i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            avgGain = ((avgGain * (period - 1)) + Math.max(change, 0.0)) / period;
            avgLoss = ((avgLoss * (period - 1)) + Math.max(-change, 0.0)) / period;
        }

        if (avgLoss == 0 && avgGain == 0) {
            return new RsiResult(50.0, true);
        }
        if (avgLoss == 0) {
            return new RsiResult(100.0, true);
        }
        double rs = avgGain / avgLoss;
        return new RsiResult(100.0 - (100.0 / (1.0 + rs)), true);
    }

    public record RsiResult(double rsi, boolean ready) {
        /**
         * RSI rescaled to [-1, 1] so that 0 is neutral.
         */
        public double centered() {
            return ready ? (rsi - 50.0) / 50.0 : 0.0;
        }
    }
}
