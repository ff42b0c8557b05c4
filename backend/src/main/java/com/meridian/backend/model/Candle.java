package com.meridian.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One OHLCV bar. Identified by symbol, timeframe and open time; a forming bar is
 * replaced by a newer instance with the same key rather than mutated.
 */
@Value
@Builder(toBuilder = true)
public class Candle {
    String symbol;
    Timeframe timeframe;
    double open;
    double high;
    double low;
    double close;
    double volume;
    Instant openTime;

    public Instant closeTime() {
        return openTime.plus(timeframe.getDuration());
    }

    public boolean isClosedAt(Instant now) {
        return !now.isBefore(closeTime());
    }

    public boolean sameKey(Candle other) {
        return other != null
                && symbol.equals(other.symbol)
                && timeframe == other.timeframe
                && openTime.equals(other.openTime);
    }
}
