package com.meridian.backend.service.indicator;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

@Service
@RequiredArgsConstructor
public class MacdService {

    private final FeatureProperties featureProperties;

    public MacdResult calculate(List<Candle> candles) {
        FeatureProperties.Macd config = featureProperties.getMacd();
        int fast = config.getFastPeriod();
        int slow = config.getSlowPeriod();
        int signal = config.getSignalPeriod();
        if (candles == null || candles.size() < slow + signal - 1) {
            return new MacdResult(0, 0, 0, false);
        }

        double[] closes = candles.stream().mapToDouble(Candle::getClose).toArray();
        double[] fastSeries = MovingAverages.emaSeries(closes, fast);
        double[] slowSeries = MovingAverages.emaSeries(closes, slow);

        double[] macdSeries = new double[closes.length];
        int count = 0;
        for (int i = 0; i < closes.length; i++) {
            if (!Double.isNaN(fastSeries[i]) && !Double.isNaN(slowSeries[i])) {
                macdSeries[count++] = fastSeries[i] - slowSeries[i];
            }
        }
        if (count < signal) {
            return new MacdResult(0, 0, 0, false);
        }

        double[] defined = Arrays.copyOf(macdSeries, count);
        double macdLine = defined[count - 1];
        double signalLine = MovingAverages.ema(defined, signal);
        return new MacdResult(macdLine, signalLine, macdLine - signalLine, true);
    }

    public record MacdResult(double macdLine, double signalLine, double histogram, boolean ready) {}
}
