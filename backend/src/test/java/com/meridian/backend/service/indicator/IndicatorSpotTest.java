package com.meridian.backend.service.indicator;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.model.Candle;
import com.meridian.backend.model.Timeframe;
import com.meridian.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IndicatorSpotTest {

    @Test
    void atrMatchesWilderCalculation() {
        FeatureProperties properties = new FeatureProperties();
        properties.getAtr().setPeriod(3);
        AtrService atrService = new AtrService(properties);

        AtrService.AtrResult result = atrService.calculate(buildTrendCandles());

        assertThat(result.ready()).isTrue();
        assertThat(result.atr()).isCloseTo(3.0, within(0.0001));
        assertThat(result.atrPercent()).isCloseTo(3.0 / 14.0, within(0.0001));
    }

    @Test
    void atrNotReadyWithoutEnoughHistory() {
        FeatureProperties properties = new FeatureProperties();
        AtrService atrService = new AtrService(properties);

        AtrService.AtrResult result = atrService.calculate(buildTrendCandles());

        assertThat(result.ready()).isFalse();
        assertThat(result.atrPercent()).isZero();
    }

    @Test
    void adxSpotCheckUptrend() {
        FeatureProperties properties = new FeatureProperties();
        properties.getAdx().setPeriod(3);
        AdxService adxService = new AdxService(properties);

        AdxService.AdxResult result = adxService.calculate(buildExtendedTrendCandles());

        assertThat(result.ready()).isTrue();
        assertThat(result.adx()).isCloseTo(100.0, within(0.0001));
        assertThat(result.plusDI()).isGreaterThan(result.minusDI());
    }

    @Test
    void bollingerBandsSpotCheck() {
        FeatureProperties properties = new FeatureProperties();
        properties.getBollinger().setPeriod(3);
        properties.getBollinger().setDeviation(2.0);
        BollingerBandService service = new BollingerBandService(properties);

        BollingerBandService.BollingerBands bands = service.calculate(candles(
                new double[]{10, 12, 9, 10},
                new double[]{11, 13, 10, 11},
                new double[]{12, 14, 11, 12}));

        assertThat(bands.middle()).isCloseTo(11.0, within(0.0001));
        assertThat(bands.upper()).isCloseTo(12.6329, within(0.001));
        assertThat(bands.lower()).isCloseTo(9.3670, within(0.001));
        assertThat(bands.percentB(11.0)).isCloseTo(0.0, within(0.0001));
    }

    @Test
    void keltnerChannelSpotCheck() {
        FeatureProperties properties = new FeatureProperties();
        properties.getKeltner().setPeriod(3);
        properties.getKeltner().setAtrMultiplier(1.5);
        properties.getAtr().setPeriod(3);
        KeltnerChannelService service = new KeltnerChannelService(properties, new AtrService(properties));

        KeltnerChannelService.KeltnerChannel channel = service.calculate(candles(
                new double[]{10, 12, 9, 10},
                new double[]{11, 13, 10, 11},
                new double[]{12, 14, 11, 12},
                new double[]{13, 15, 12, 13}));

        assertThat(channel.middle()).isCloseTo(12.0, within(0.0001));
        assertThat(channel.upper()).isCloseTo(16.5, within(0.0001));
        assertThat(channel.lower()).isCloseTo(7.5, within(0.0001));
    }

    @Test
    void rsiSaturatesOnPureUptrend() {
        FeatureProperties properties = new FeatureProperties();
        RsiService service = new RsiService(properties);

        RsiService.RsiResult result = service.calculate(TestCandleFactory.trendingCandles(30, 100, 1.0));

        assertThat(result.rsi()).isEqualTo(100.0);
        assertThat(result.centered()).isEqualTo(1.0);
    }

    @Test
    void rsiCenteredIsNeutralWhenNotReady() {
        RsiService service = new RsiService(new FeatureProperties());

        RsiService.RsiResult result = service.calculate(TestCandleFactory.trendingCandles(5, 100, 1.0));

        assertThat(result.ready()).isFalse();
        assertThat(result.centered()).isZero();
    }

    @Test
    void macdPositiveInUptrend() {
        MacdService service = new MacdService(new FeatureProperties());

        MacdService.MacdResult result = service.calculate(TestCandleFactory.trendingCandles(60, 100, 1.0));

        assertThat(result.ready()).isTrue();
        assertThat(result.macdLine()).isGreaterThan(0.0);
    }

    @Test
    void stochasticAtTopOfRangeInUptrend() {
        FeatureProperties properties = new FeatureProperties();
        properties.getStochastic().setPeriod(3);
        properties.getStochastic().setSmoothing(1);
        StochasticService service = new StochasticService(properties);

        StochasticService.StochasticResult result = service.calculate(candles(
                new double[]{10, 11, 9, 10},
                new double[]{10, 12, 10, 11},
                new double[]{11, 13, 11, 13}));

        assertThat(result.ready()).isTrue();
        assertThat(result.percentK()).isCloseTo(100.0, within(0.0001));
        assertThat(result.williamsR()).isCloseTo(0.0, within(0.0001));
    }

    private List<Candle> buildTrendCandles() {
        return candles(
                new double[]{10, 12, 9, 11},
                new double[]{11, 13, 10, 12},
                new double[]{12, 14, 11, 13},
                new double[]{13, 15, 12, 14});
    }

    private List<Candle> buildExtendedTrendCandles() {
        return candles(
                new double[]{10, 12, 9, 11},
                new double[]{11, 13, 10, 12},
                new double[]{12, 14, 11, 13},
                new double[]{13, 15, 12, 14},
                new double[]{14, 16, 13, 15},
                new double[]{15, 17, 14, 16});
    }

    private List<Candle> candles(double[]... ohlc) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < ohlc.length; i++) {
            double[] bar = ohlc[i];
            candles.add(TestCandleFactory.candle("BTCUSDT", Timeframe.M15,
                    TestCandleFactory.START.plus(Timeframe.M15.getDuration().multipliedBy(i)),
                    bar[0], bar[1], bar[2], bar[3], 1000.0));
        }
        return candles;
    }
}
