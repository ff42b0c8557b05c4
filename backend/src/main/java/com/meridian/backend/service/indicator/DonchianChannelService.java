package com.meridian.backend.service.indicator;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class DonchianChannelService {

    private final FeatureProperties featureProperties;

    /**
     * Channel over the {@code period} candles before the last one, so a breakout by the
     * last candle shows up as a position outside [-0.5, 0.5].
     */
    public Donchian calculate(List<Candle> candles) {
        int period = featureProperties.getChannel().getDonchianPeriod();
        if (candles == null || candles.size() < period + 1) {
            return new Donchian(0.0, 0.0, false);
        }
        int endExclusive = candles.size() - 1;
        double upper = Double.NEGATIVE_INFINITY;
        double lower = Double.POSITIVE_INFINITY;
        for (int i = endExclusive - period; i < endExclusive; i++) {
            Candle candle = candles.get(i);
            upper = Math.max(upper, candle.getHigh());
            lower = Math.min(lower, candle.getLow());
        }
        return new Donchian(upper, lower, true);
    }

    public record Donchian(double upper, double lower, boolean ready) {

        public double position(double close) {
            double range = upper - lower;
            return ready && range > 0 ? (close - lower) / range - 0.5 : 0.0;
        }
    }
}
