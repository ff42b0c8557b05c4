package com.meridian.backend.util;

import com.meridian.backend.model.Candle;
import com.meridian.backend.model.Timeframe;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class TestCandleFactory {

    public static final Instant START = Instant.parse("2026-01-05T00:00:00Z");

    private TestCandleFactory() {}

    public static List<Candle> trendingCandles(int count, double start, double step) {
        return trendingCandles("BTCUSDT", Timeframe.M15, START, count, start, step);
    }

    public static List<Candle> trendingCandles(String symbol, Timeframe timeframe, Instant from,
                                               int count, double start, double step) {
        List<Candle> candles = new ArrayList<>();
        double price = start;
        for (int i = 0; i < count; i++) {
            double open = price;
            double close = price + step;
            double high = Math.max(open, close) + Math.abs(step) * 0.3;
            double low = Math.min(open, close) - Math.abs(step) * 0.2;
            candles.add(candle(symbol, timeframe, from.plus(timeframe.getDuration().multipliedBy(i)),
                    open, high, low, close, 1000.0 + i * 10.0));
            price = close;
        }
        return candles;
    }

    public static List<Candle> oscillatingCandles(int count, double base, double amplitude) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double offset = Math.sin(i / 3.0) * amplitude;
            double open = base + offset;
            double close = base - offset * 0.5;
            double high = Math.max(open, close) + amplitude * 0.5;
            double low = Math.min(open, close) - amplitude * 0.5;
            candles.add(candle("BTCUSDT", Timeframe.M15, START.plus(Timeframe.M15.getDuration().multipliedBy(i)),
                    open, high, low, close, 900.0 + i * 5.0));
        }
        return candles;
    }

    public static Candle candle(String symbol, Timeframe timeframe, Instant openTime,
                                double open, double high, double low, double close, double volume) {
        return Candle.builder()
                .symbol(symbol)
                .timeframe(timeframe)
                .openTime(openTime)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .build();
    }
}
