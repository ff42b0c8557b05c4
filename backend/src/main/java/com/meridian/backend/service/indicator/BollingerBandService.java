package com.meridian.backend.service.indicator;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class BollingerBandService {

    private final FeatureProperties featureProperties;

    public BollingerBands calculate(List<Candle> candles) {
        FeatureProperties.Bollinger config = featureProperties.getBollinger();
        int period = config.getPeriod();
        if (candles == null || candles.size() < period) {
            return new BollingerBands(0, 0, 0, 0, false);
        }
        List<Candle> window = candles.subList(candles.size() - period, candles.size());
        double mean = window.stream().mapToDouble(Candle::getClose).average().orElse(0.0);
        double variance = window.stream()
                .mapToDouble(candle -> {
                    double diff = candle.getClose() - mean;
                    return diff * diff;
                })
                .average()
                .orElse(0.0);
        double band = Math.sqrt(variance) * config.getDeviation();
        return new BollingerBands(mean + band, mean, mean - band, 2 * band, true);
    }

    public record BollingerBands(double upper, double middle, double lower, double width, boolean ready) {

        public double relativeWidth() {
            return ready && middle != 0 ? width / middle : 0.0;
        }

        /**
         * %B shifted so the middle band maps to 0.
         */
        public double percentB(double close) {
            return ready && width > 0 ? (close - lower) / width - 0.5 : 0.0;
        }
    }
}
