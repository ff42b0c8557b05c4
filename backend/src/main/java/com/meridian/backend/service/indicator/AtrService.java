package com.meridian.backend.service.indicator;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class AtrService {

    private final FeatureProperties featureProperties;

    public AtrResult calculate(List<Candle> candles) {
        return calculate(candles, featureProperties.getAtr().getPeriod());
    }

    /**
     * Wilder-smoothed ATR; {@code atrPercent} is a fraction of the last close.
     */
    public AtrResult calculate(List<Candle> candles, int period) {
        if (candles == null || candles.size() < period + 1) {
            return AtrResult.notReady();
        }
        double[] tr = trueRanges(candles);
        double atr = 0.0;
        for (int i = 0; i < period; i++) {
            atr += tr[i];
        }
        atr /= period;
        for (int i = period; i < tr.length; i++) {
            atr = ((atr * (period - 1)) + tr[i]) / period;
        }
        double lastClose = candles.get(candles.size() - 1).getClose();
        double atrPercent = lastClose <= 0 ? 0.0 : atr / lastClose;
        return new AtrResult(atr, atrPercent, true);
    }

    static double[] trueRanges(List<Candle> candles) {
        double[] tr = new double[candles.size() - 1];
        for (int i = 1; i < candles.size(); i++) {
            Candle curr = candles.get(i);
            Candle prev = candles.get(i - 1);
            tr[i - 1] = Math.max(curr.getHigh() - curr.getLow(),
                    Math.max(Math.abs(curr.getHigh() - prev.getClose()), Math.abs(curr.getLow() - prev.getClose())));
        }
        return tr;
    }

    public record AtrResult(double atr, double atrPercent, boolean ready) {
        static AtrResult notReady() {
            return new AtrResult(0.0, 0.0, false);
        }
    }
}
