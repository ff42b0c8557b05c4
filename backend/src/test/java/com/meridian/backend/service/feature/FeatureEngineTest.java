package com.meridian.backend.service.feature;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.exception.FeatureComputationException;
import com.meridian.backend.exception.InsufficientWindowException;
import com.meridian.backend.model.Candle;
import com.meridian.backend.model.FeatureVector;
import com.meridian.backend.model.Timeframe;
import com.meridian.backend.service.indicator.AdxService;
import com.meridian.backend.service.indicator.AtrService;
import com.meridian.backend.service.indicator.BollingerBandService;
import com.meridian.backend.service.indicator.ChoppinessIndexService;
import com.meridian.backend.service.indicator.DonchianChannelService;
import com.meridian.backend.service.indicator.KeltnerChannelService;
import com.meridian.backend.service.indicator.MacdService;
import com.meridian.backend.service.indicator.RsiService;
import com.meridian.backend.service.indicator.StochasticService;
import com.meridian.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureEngineTest {

    private final FeatureProperties properties = new FeatureProperties();
    private final FeatureEngine engine = featureEngine(properties);

    static FeatureEngine featureEngine(FeatureProperties properties) {
        AtrService atrService = new AtrService(properties);
        return new FeatureEngine(
                properties,
                new RsiService(properties),
                new StochasticService(properties),
                new MacdService(properties),
                new AdxService(properties),
                atrService,
                new BollingerBandService(properties),
                new KeltnerChannelService(properties, atrService),
                new DonchianChannelService(properties),
                new ChoppinessIndexService(properties)
        );
    }

    @Test
    void producesFixedLengthFiniteVector() {
        List<Candle> window = TestCandleFactory.trendingCandles(properties.getLookback(), 100, 0.5);

        FeatureVector vector = engine.compute(window);

        assertThat(vector.size()).isEqualTo(engine.featureCount()).isEqualTo(44);
        assertThat(vector.getNames()).isEqualTo(FeatureEngine.FEATURE_NAMES);
        assertThat(vector.isFinite()).isTrue();
        assertThat(vector.getSymbol()).isEqualTo("BTCUSDT");
        assertThat(vector.getAsOf()).isEqualTo(window.get(window.size() - 1).getOpenTime());
    }

    @Test
    void sameWindowGivesSameVector() {
        List<Candle> window = TestCandleFactory.oscillatingCandles(properties.getLookback(), 100, 2.0);

        assertThat(engine.compute(window)).isEqualTo(engine.compute(List.copyOf(window)));
    }

    @Test
    void distinctHistoriesGiveDistinctVectors() {
        List<Candle> rising = TestCandleFactory.trendingCandles(properties.getLookback(), 100, 0.5);
        List<Candle> falling = TestCandleFactory.trendingCandles(properties.getLookback(), 150, -0.5);

        FeatureVector up = engine.compute(rising);
        FeatureVector down = engine.compute(falling);

        assertThat(Arrays.equals(up.getValues(), down.getValues())).isFalse();
        assertThat(up.get("ret_1")).isPositive();
        assertThat(down.get("ret_1")).isNegative();
        assertThat(up.get("rsi")).isGreaterThan(down.get("rsi"));
    }

    @Test
    void indicatorsWithoutHistoryAreNeutral() {
        FeatureProperties shortLookback = new FeatureProperties();
        shortLookback.setLookback(30);
        FeatureEngine shortEngine = featureEngine(shortLookback);

        FeatureVector vector = shortEngine.compute(TestCandleFactory.trendingCandles(30, 100, 0.5));

        assertThat(vector.get("close_sma_50")).isZero();
        assertThat(vector.get("ret_48")).isZero();
        assertThat(vector.get("macd_line")).isZero();
        assertThat(vector.isFinite()).isTrue();
    }

    @Test
    void flatCandlesStayFinite() {
        List<Candle> flat = new ArrayList<>();
        for (int i = 0; i < properties.getLookback(); i++) {
            flat.add(TestCandleFactory.candle("ETHUSDT", Timeframe.M15,
                    TestCandleFactory.START.plus(Timeframe.M15.getDuration().multipliedBy(i)),
                    100, 100, 100, 100, 0));
        }

        FeatureVector vector = engine.compute(flat);

        assertThat(vector.isFinite()).isTrue();
        assertThat(vector.get("volume_ratio")).isZero();
        assertThat(vector.get("body_ratio")).isZero();
    }

    @Test
    void rejectsWindowOfWrongLength() {
        List<Candle> window = TestCandleFactory.trendingCandles(properties.getLookback() - 1, 100, 0.5);

        assertThatThrownBy(() -> engine.compute(window))
                .isInstanceOf(InsufficientWindowException.class)
                .hasMessageContaining("expected " + properties.getLookback());
    }

    @Test
    void rejectsEmptyWindow() {
        assertThatThrownBy(() -> engine.compute(List.of()))
                .isInstanceOf(InsufficientWindowException.class);
    }

    @Test
    void rejectsMixedSymbols() {
        List<Candle> window = new ArrayList<>(TestCandleFactory.trendingCandles(properties.getLookback(), 100, 0.5));
        Candle last = window.remove(window.size() - 1);
        window.add(last.toBuilder().symbol("ETHUSDT").build());

        assertThatThrownBy(() -> engine.compute(window))
                .isInstanceOf(FeatureComputationException.class)
                .hasMessageContaining("mixes symbols");
    }

    @Test
    void rejectsOutOfOrderWindow() {
        List<Candle> window = new ArrayList<>(TestCandleFactory.trendingCandles(properties.getLookback(), 100, 0.5));
        Candle first = window.get(0);
        window.set(0, window.get(1));
        window.set(1, first);

        assertThatThrownBy(() -> engine.compute(window))
                .isInstanceOf(FeatureComputationException.class);
    }
}
