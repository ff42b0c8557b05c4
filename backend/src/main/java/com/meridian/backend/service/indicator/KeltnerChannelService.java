package com.meridian.backend.service.indicator;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class KeltnerChannelService {

    private final FeatureProperties featureProperties;
    private final AtrService atrService;

    public KeltnerChannel calculate(List<Candle> candles) {
        FeatureProperties.Keltner config = featureProperties.getKeltner();
        int period = config.getPeriod();
        if (candles == null || candles.size() < period) {
            return new KeltnerChannel(0, 0, 0, false);
        }
        double[] closes = candles.stream().mapToDouble(Candle::getClose).toArray();
        double middle = MovingAverages.ema(closes, period);
        AtrService.AtrResult atr = atrService.calculate(candles);
        if (!atr.ready()) {
            return new KeltnerChannel(middle, middle, middle, false);
        }
        double offset = atr.atr() * config.getAtrMultiplier();
        return new KeltnerChannel(middle + offset, middle, middle - offset, true);
    }

    public record KeltnerChannel(double upper, double middle, double lower, boolean ready) {

        public double relativeWidth() {
            return ready && middle != 0 ? (upper - lower) / middle : 0.0;
        }
    }
}
