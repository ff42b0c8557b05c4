package com.meridian.backend.service.marketdata;

import com.meridian.backend.exception.DataUnavailableException;
import com.meridian.backend.model.Candle;
import com.meridian.backend.model.Timeframe;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

@Slf4j
public class UnconfiguredCandleSource implements CandleSource {

    @Override
    public List<Candle> fetchCandles(String symbol, Timeframe timeframe, Instant since) {
        log.warn("No candle source configured, cannot fetch {} {}", symbol, timeframe);
        throw new DataUnavailableException(symbol, "No candle source configured");
    }
}
