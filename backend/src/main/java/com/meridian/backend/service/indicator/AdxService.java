package com.meridian.backend.service.indicator;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class AdxService {

    private final FeatureProperties featureProperties;

    public AdxResult calculate(List<Candle> candles) {
        int period = featureProperties.getAdx().getPeriod();
        if (candles == null || candles.size() < period + 1) {
            return new AdxResult(0, 0, 0, false);
        }

        int n = candles.size() - 1;
        double[] tr = AtrService.trueRanges(candles);
        double[] dmPlus = new double[n];
        double[] dmMinus = new double[n];
        for (int i = 1; i < candles.size(); i++) {
            Candle curr = candles.get(i);
            Candle prev = candles.get(i - 1);
            double highDiff = curr.getHigh() - prev.getHigh();
            double lowDiff = prev.getLow() - curr.getLow();
            dmPlus[i - 1] = (highDiff > lowDiff && highDiff > 0) ? highDiff : 0.0;
            dmMinus[i - 1] = (lowDiff > highDiff && lowDiff > 0) ? lowDiff : 0.0;
        }

        double smoothTR = 0.0;
        double smoothPlus = 0.0;
        double smoothMinus = 0.0;
        for (int i = 0; i < period; i++) {
            smoothTR += tr[i];
            smoothPlus += dmPlus[i];
            smoothMinus += dmMinus[i];
        }

        List<Double> dxValues = new ArrayList<>();
        double plusDI = 0.0;
        double minusDI = 0.0;
        for (int i = period - 1; i < n; i++) {
            if (i > period - 1) {
                smoothTR = smoothTR - (smoothTR / period) + tr[i];
                smoothPlus = smoothPlus - (smoothPlus / period) + dmPlus[i];
                smoothMinus = smoothMinus - (smoothMinus / period) + dmMinus[i];
            }
            if (smoothTR == 0) {
                continue;
            }
            plusDI = 100.0 * (smoothPlus / smoothTR);
            minusDI = 100.0 * (smoothMinus / smoothTR);
            double diSum = plusDI + minusDI;
            dxValues.add(diSum == 0 ? 0.0 : (Math.abs(plusDI - minusDI) / diSum) * 100.0);
        }

        // DI lines are usable before ADX has its own smoothing history
        if (dxValues.size() < period) {
            return new AdxResult(0, plusDI, minusDI, false);
        }
        double adx = dxValues.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        for (int i = period; i < dxValues.size(); i++) {
            adx = ((adx * (period - 1)) + dxValues.get(i)) / period;
        }
        return new AdxResult(adx, plusDI, minusDI, true);
    }

    public record AdxResult(double adx, double plusDI, double minusDI, boolean ready) {}
}
