package com.meridian.backend.service.feature;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.exception.FeatureComputationException;
import com.meridian.backend.exception.InsufficientWindowException;
import com.meridian.backend.model.Candle;
import com.meridian.backend.model.FeatureVector;
import com.meridian.backend.service.indicator.AdxService;
import com.meridian.backend.service.indicator.AtrService;
import com.meridian.backend.service.indicator.BollingerBandService;
import com.meridian.backend.service.indicator.ChoppinessIndexService;
import com.meridian.backend.service.indicator.DonchianChannelService;
import com.meridian.backend.service.indicator.KeltnerChannelService;
import com.meridian.backend.service.indicator.MacdService;
import com.meridian.backend.service.indicator.MovingAverages;
import com.meridian.backend.service.indicator.RsiService;
import com.meridian.backend.service.indicator.StochasticService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.meridian.backend.service.feature.FeatureMath.finiteOrZero;
import static com.meridian.backend.service.feature.FeatureMath.logReturn;
import static com.meridian.backend.service.feature.FeatureMath.mean;
import static com.meridian.backend.service.feature.FeatureMath.relative;
import static com.meridian.backend.service.feature.FeatureMath.safeDiv;
import static com.meridian.backend.service.feature.FeatureMath.slope;
import static com.meridian.backend.service.feature.FeatureMath.stdDev;

/**
 * Turns one candle window into the fixed, named feature vector the model was trained on.
 * <p>
 * Every feature is scaled so that 0.0 is its neutral value; an indicator that lacks
 * history for the configured window contributes exactly 0.0. The result depends only on
 * the window contents.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FeatureEngine {

    public static final List<String> FEATURE_NAMES = List.of(
            "ret_1", "ret_4", "ret_16", "ret_48",
            "close_sma_20", "close_sma_50", "close_ema_fast", "close_ema_slow",
            "ema_cross",
            "rsi", "stoch_k", "stoch_d", "williams_r",
            "macd_line", "macd_signal", "macd_hist",
            "adx", "plus_di", "minus_di",
            "atr_pct", "bb_width", "bb_pct_b", "keltner_width", "donchian_pos", "choppiness",
            "rv_short", "rv_full", "parkinson_vol",
            "volume_ratio", "volume_zscore", "volume_trend", "obv_slope", "vwap_dev",
            "body_ratio", "upper_wick", "lower_wick", "close_location", "range_pct", "gap_pct",
            "amihud", "roll_spread", "up_bar_ratio",
            "hour_sin", "hour_cos"
    );

    private static final int SHORT_SPAN = 16;
    private static final int VOLUME_SPAN = 20;
    private static final int VOLUME_TREND_SPAN = 5;

    private final FeatureProperties properties;
    private final RsiService rsiService;
    private final StochasticService stochasticService;
    private final MacdService macdService;
    private final AdxService adxService;
    private final AtrService atrService;
    private final BollingerBandService bollingerBandService;
    private final KeltnerChannelService keltnerChannelService;
    private final DonchianChannelService donchianChannelService;
    private final ChoppinessIndexService choppinessIndexService;

    public int featureCount() {
        return FEATURE_NAMES.size();
    }

    /**
     * @throws InsufficientWindowException if the window length differs from the configured lookback
     * @throws FeatureComputationException if the window is malformed or a feature is not finite
     */
    public FeatureVector compute(List<Candle> window) {
        int lookback = properties.getLookback();
        if (window == null || window.isEmpty()) {
            throw new InsufficientWindowException("unknown", lookback, 0);
        }
        String symbol = window.get(0).getSymbol();
        if (window.size() != lookback) {
            throw new InsufficientWindowException(symbol, lookback, window.size());
        }
        validateWindow(symbol, window);

        Map<String, Double> features = new LinkedHashMap<>();
        double[] closes = window.stream().mapToDouble(Candle::getClose).toArray();
        Candle last = window.get(window.size() - 1);
        double close = last.getClose();

        addReturnFeatures(features, closes);
        addTrendFeatures(features, closes, close);
        addOscillatorFeatures(features, window);
        addVolatilityFeatures(features, window, closes, close);
        addVolumeFeatures(features, window, closes);
        addMicrostructureFeatures(features, window, closes);
        addCalendarFeatures(features, last.getOpenTime());

        double[] values = new double[FEATURE_NAMES.size()];
        for (int i = 0; i < FEATURE_NAMES.size(); i++) {
            String name = FEATURE_NAMES.get(i);
            Double value = features.get(name);
            if (value == null) {
                throw new FeatureComputationException(symbol, "Feature " + name + " was not computed");
            }
            if (!Double.isFinite(value)) {
                throw new FeatureComputationException(symbol, "Feature " + name + " is not finite: " + value);
            }
            values[i] = value;
        }
        log.debug("Computed {} features symbol={} asOf={}", values.length, symbol, last.getOpenTime());
        return new FeatureVector(symbol, last.getOpenTime(), FEATURE_NAMES, values);
    }

    private void validateWindow(String symbol, List<Candle> window) {
        Instant previous = null;
        for (Candle candle : window) {
            if (!symbol.equals(candle.getSymbol())) {
                throw new FeatureComputationException(symbol, "Window mixes symbols: " + symbol + " and " + candle.getSymbol());
            }
            if (previous != null && !candle.getOpenTime().isAfter(previous)) {
                throw new FeatureComputationException(symbol, "Window is not strictly time-ordered at " + candle.getOpenTime());
            }
            previous = candle.getOpenTime();
        }
    }

    private void addReturnFeatures(Map<String, Double> features, double[] closes) {
        int lastIndex = closes.length - 1;
        for (int span : new int[]{1, 4, 16, 48}) {
            double value = span <= lastIndex ? logReturn(closes[lastIndex - span], closes[lastIndex]) : 0.0;
            features.put("ret_" + span, value);
        }
    }

    private void addTrendFeatures(Map<String, Double> features, double[] closes, double close) {
        FeatureProperties.Macd macd = properties.getMacd();
        double emaFast = MovingAverages.ema(closes, macd.getFastPeriod());
        double emaSlow = MovingAverages.ema(closes, macd.getSlowPeriod());
        features.put("close_sma_20", relative(close, MovingAverages.sma(closes, 20)));
        features.put("close_sma_50", relative(close, MovingAverages.sma(closes, 50)));
        features.put("close_ema_fast", relative(close, emaFast));
        features.put("close_ema_slow", relative(close, emaSlow));
        features.put("ema_cross", Double.isNaN(emaFast) || Double.isNaN(emaSlow) ? 0.0 : safeDiv(emaFast - emaSlow, close));
    }

    private void addOscillatorFeatures(Map<String, Double> features, List<Candle> window) {
        double close = window.get(window.size() - 1).getClose();

        features.put("rsi", rsiService.calculate(window).centered());

        StochasticService.StochasticResult stochastic = stochasticService.calculate(window);
        features.put("stoch_k", stochastic.ready() ? (stochastic.percentK() - 50.0) / 50.0 : 0.0);
        features.put("stoch_d", stochastic.ready() ? (stochastic.percentD() - 50.0) / 50.0 : 0.0);
        features.put("williams_r", stochastic.ready() ? (stochastic.williamsR() + 50.0) / 50.0 : 0.0);

        MacdService.MacdResult macd = macdService.calculate(window);
        features.put("macd_line", macd.ready() ? safeDiv(macd.macdLine(), close) : 0.0);
        features.put("macd_signal", macd.ready() ? safeDiv(macd.signalLine(), close) : 0.0);
        features.put("macd_hist", macd.ready() ? safeDiv(macd.histogram(), close) : 0.0);

        AdxService.AdxResult adx = adxService.calculate(window);
        features.put("adx", adx.ready() ? adx.adx() / 100.0 : 0.0);
        features.put("plus_di", adx.plusDI() / 100.0);
        features.put("minus_di", adx.minusDI() / 100.0);
    }

    private void addVolatilityFeatures(Map<String, Double> features, List<Candle> window, double[] closes, double close) {
        features.put("atr_pct", atrService.calculate(window).atrPercent());

        BollingerBandService.BollingerBands bands = bollingerBandService.calculate(window);
        features.put("bb_width", bands.relativeWidth());
        features.put("bb_pct_b", bands.percentB(close));
        features.put("keltner_width", keltnerChannelService.calculate(window).relativeWidth());
        features.put("donchian_pos", donchianChannelService.calculate(window).position(close));

        ChoppinessIndexService.ChopResult chop = choppinessIndexService.calculate(window);
        features.put("choppiness", chop.ready() ? chop.chop() / 100.0 : 0.0);

        double[] returns = new double[closes.length - 1];
        for (int i = 1; i < closes.length; i++) {
            returns[i - 1] = logReturn(closes[i - 1], closes[i]);
        }
        int shortFrom = Math.max(0, returns.length - SHORT_SPAN);
        features.put("rv_short", stdDev(returns, shortFrom, returns.length));
        features.put("rv_full", stdDev(returns, 0, returns.length));

        double sumSquares = 0.0;
        int counted = 0;
        for (Candle candle : window) {
            if (candle.getLow() > 0 && candle.getHigh() >= candle.getLow()) {
                double hl = Math.log(candle.getHigh() / candle.getLow());
                sumSquares += hl * hl;
                counted++;
            }
        }
        features.put("parkinson_vol", counted == 0 ? 0.0 : Math.sqrt(sumSquares / (4.0 * Math.log(2.0) * counted)));
    }

    private void addVolumeFeatures(Map<String, Double> features, List<Candle> window, double[] closes) {
        double[] volumes = window.stream().mapToDouble(Candle::getVolume).toArray();
        int n = volumes.length;
        int from = Math.max(0, n - VOLUME_SPAN);
        double lastVolume = volumes[n - 1];
        double meanVolume = mean(volumes, from, n);

        features.put("volume_ratio", meanVolume > 0 ? lastVolume / meanVolume - 1.0 : 0.0);
        features.put("volume_zscore", safeDiv(lastVolume - meanVolume, stdDev(volumes, from, n)));
        double recentVolume = mean(volumes, Math.max(0, n - VOLUME_TREND_SPAN), n);
        features.put("volume_trend", meanVolume > 0 ? recentVolume / meanVolume - 1.0 : 0.0);

        double[] obv = new double[n];
        for (int i = 1; i < n; i++) {
            double direction = Math.signum(closes[i] - closes[i - 1]);
            obv[i] = obv[i - 1] + direction * volumes[i];
        }
        features.put("obv_slope", safeDiv(slope(obv, from, n), meanVolume));

        double priceVolume = 0.0;
        double totalVolume = 0.0;
        for (Candle candle : window) {
            double typical = (candle.getHigh() + candle.getLow() + candle.getClose()) / 3.0;
            priceVolume += typical * candle.getVolume();
            totalVolume += candle.getVolume();
        }
        double vwap = totalVolume > 0 ? priceVolume / totalVolume : Double.NaN;
        features.put("vwap_dev", relative(closes[n - 1], vwap));
    }

    private void addMicrostructureFeatures(Map<String, Double> features, List<Candle> window, double[] closes) {
        int n = window.size();
        Candle last = window.get(n - 1);
        double range = last.getHigh() - last.getLow();
        double bodyTop = Math.max(last.getOpen(), last.getClose());
        double bodyBottom = Math.min(last.getOpen(), last.getClose());

        features.put("body_ratio", safeDiv(bodyTop - bodyBottom, range));
        features.put("upper_wick", safeDiv(last.getHigh() - bodyTop, range));
        features.put("lower_wick", safeDiv(bodyBottom - last.getLow(), range));
        features.put("close_location", range > 0 ? 2.0 * (last.getClose() - last.getLow()) / range - 1.0 : 0.0);
        features.put("range_pct", safeDiv(range, last.getClose()));
        features.put("gap_pct", n > 1 ? relative(last.getOpen(), closes[n - 2]) : 0.0);

        int from = Math.max(1, n - VOLUME_SPAN);
        double illiquidity = 0.0;
        int upBars = 0;
        for (int i = from; i < n; i++) {
            Candle candle = window.get(i);
            double dollarVolume = candle.getClose() * candle.getVolume();
            illiquidity += safeDiv(Math.abs(logReturn(closes[i - 1], closes[i])), dollarVolume);
            if (closes[i] > closes[i - 1]) {
                upBars++;
            }
        }
        int bars = n - from;
        features.put("amihud", bars > 0 ? finiteOrZero(illiquidity / bars * 1e6) : 0.0);
        features.put("up_bar_ratio", bars > 0 ? (double) upBars / bars - 0.5 : 0.0);
        features.put("roll_spread", rollSpread(closes, from));
    }

    /**
     * Roll's estimator from the serial covariance of price changes, as a fraction of the
     * last close. Positive covariance carries no spread information and maps to 0.
     */
    private double rollSpread(double[] closes, int from) {
        int n = closes.length;
        if (n - from < 3) {
            return 0.0;
        }
        double[] changes = new double[n - from];
        for (int i = from; i < n; i++) {
            changes[i - from] = closes[i] - closes[i - 1];
        }
        double meanChange = mean(changes, 0, changes.length);
        double covariance = 0.0;
        for (int i = 1; i < changes.length; i++) {
            covariance += (changes[i] - meanChange) * (changes[i - 1] - meanChange);
        }
        covariance /= (changes.length - 1);
        if (covariance >= 0) {
            return 0.0;
        }
        return safeDiv(2.0 * Math.sqrt(-covariance), closes[n - 1]);
    }

    private void addCalendarFeatures(Map<String, Double> features, Instant openTime) {
        ZonedDateTime utc = openTime.atZone(ZoneOffset.UTC);
        double hour = utc.getHour() + utc.getMinute() / 60.0;
        double angle = 2.0 * Math.PI * hour / 24.0;
        features.put("hour_sin", Math.sin(angle));
        features.put("hour_cos", Math.cos(angle));
    }
}
