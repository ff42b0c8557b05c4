package com.meridian.backend.service.indicator;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class ChoppinessIndexService {

    private final FeatureProperties featureProperties;

    public ChopResult calculate(List<Candle> candles) {
        int period = featureProperties.getChannel().getChoppinessPeriod();
        if (candles == null || candles.size() < period + 1 || period < 2) {
            return new ChopResult(0.0, false);
        }
        int endIndex = candles.size() - 1;
        double highestHigh = Double.NEGATIVE_INFINITY;
        double lowestLow = Double.POSITIVE_INFINITY;
        double trSum = 0.0;
        for (int i = endIndex - period + 1; i <= endIndex; i++) {
            Candle current = candles.get(i);
            Candle prev = candles.get(i - 1);
            trSum += Math.max(current.getHigh() - current.getLow(),
                    Math.max(Math.abs(current.getHigh() - prev.getClose()), Math.abs(current.getLow() - prev.getClose())));
            highestHigh = Math.max(highestHigh, current.getHigh());
            lowestLow = Math.min(lowestLow, current.getLow());
        }

        double range = highestHigh - lowestLow;
        if (range <= 0 || trSum <= 0) {
            return new ChopResult(0.0, false);
        }
        double chop = 100.0 * (Math.log10(trSum / range) / Math.log10(period));
        if (!Double.isFinite(chop)) {
            return new ChopResult(0.0, false);
        }
        return new ChopResult(chop, true);
    }

    public record ChopResult(double chop, boolean ready) {}
}
