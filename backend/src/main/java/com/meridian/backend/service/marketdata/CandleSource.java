package com.meridian.backend.service.marketdata;

import com.meridian.backend.model.Candle;
import com.meridian.backend.model.Timeframe;

import java.time.Instant;
import java.util.List;

/**
 * Upstream OHLCV provider. Implementations return candles ordered oldest first, starting
 * at or after {@code since}; the last one may still be forming.
 *
 * @throws com.meridian.backend.exception.RateLimitedException when the provider asks the caller to back off
 * @throws com.meridian.backend.exception.DataUnavailableException when the provider cannot serve the request
 */
public interface CandleSource {

    List<Candle> fetchCandles(String symbol, Timeframe timeframe, Instant since);
}
