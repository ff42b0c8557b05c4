package com.meridian.backend.service.marketdata;

import com.meridian.backend.config.MarketDataProperties;
import com.meridian.backend.exception.DataUnavailableException;
import com.meridian.backend.exception.InsufficientHistoryException;
import com.meridian.backend.exception.PipelineException;
import com.meridian.backend.exception.RateLimitedException;
import com.meridian.backend.model.Candle;
import com.meridian.backend.model.Timeframe;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory candle store in front of the rate-limited {@link CandleSource}.
 * <p>
 * A window is served from memory while its last candle is younger than one timeframe
 * period. Otherwise one fetch per series is issued and every concurrent caller for that
 * series waits on the same future. When the upstream fails, a cached window is still
 * served if its last candle closed within the staleness tolerance.
 */
@Service
@Slf4j
public class MarketDataCache {

    private final CandleSource candleSource;
    private final MarketDataProperties properties;
    private final RateLimiter rateLimiter;
    private final Executor fetchExecutor;
    private final Clock clock;

    private final Map<SeriesKey, CandleSeries> seriesByKey = new ConcurrentHashMap<>();
    private final Map<SeriesKey, Future<Integer>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong fetches = new AtomicLong();
    private final AtomicLong coalescedWaits = new AtomicLong();
    private final AtomicLong staleServes = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public MarketDataCache(CandleSource candleSource,
                           MarketDataProperties properties,
                           RateLimiter marketDataRateLimiter,
                           @Qualifier("marketDataExecutor") Executor fetchExecutor,
                           Clock clock) {
        this.candleSource = candleSource;
        this.properties = properties;
        this.rateLimiter = marketDataRateLimiter;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
    }

    /**
     * Returns exactly {@code length} candles, oldest first.
     *
     * @throws InsufficientHistoryException if fewer candles exist even after a fetch
     * @throws RateLimitedException         if the upstream throttled and no usable cache exists
     * @throws DataUnavailableException     if the upstream failed and no usable cache exists
     */
    public List<Candle> getWindow(String symbol, Timeframe timeframe, int length) {
        if (length > properties.getMaxCandles()) {
            throw new InsufficientHistoryException(symbol, length, properties.getMaxCandles());
        }
        Instant now = clock.instant();
        SeriesKey key = new SeriesKey(symbol, timeframe);
        CandleSeries series = seriesByKey.computeIfAbsent(key, k -> new CandleSeries(properties.getMaxCandles(), now));
        series.touch(now);

        if (isFresh(series, timeframe, length, now)) {
            hits.incrementAndGet();
            return series.tail(length);
        }
        misses.incrementAndGet();

        try {
            awaitFetch(key, series, length);
        } catch (RateLimitedException | DataUnavailableException ex) {
            if (series.size() >= length && withinTolerance(series, now)) {
                staleServes.incrementAndGet();
                log.warn("Serving stale window symbol={} tf={} lastOpen={} cause={}",
                        symbol, timeframe, series.last().getOpenTime(), ex.getMessage());
                return series.tail(length);
            }
            throw ex;
        }

        List<Candle> window = series.tail(length);
        if (window.size() < length) {
            throw new InsufficientHistoryException(symbol, length, window.size());
        }
        return window;
    }

    /**
     * Live-stream upsert of the forming candle; the series is created on first sight.
     */
    public void updateLastCandle(Candle candle) {
        Instant now = clock.instant();
        SeriesKey key = new SeriesKey(candle.getSymbol(), candle.getTimeframe());
        CandleSeries series = seriesByKey.computeIfAbsent(key, k -> new CandleSeries(properties.getMaxCandles(), now));
        series.merge(List.of(candle), now);
        log.debug("Updated last candle symbol={} tf={} open={}", candle.getSymbol(), candle.getTimeframe(), candle.getOpenTime());
    }

    @Scheduled(fixedDelayString = "${meridian.market-data.eviction-interval:PT1M}")
    public void evictIdle() {
        Instant cutoff = clock.instant().minus(properties.getTtl());
        seriesByKey.entrySet().removeIf(entry -> {
            boolean idle = entry.getValue().getLastAccessedAt().isBefore(cutoff)
                    && !inFlight.containsKey(entry.getKey());
            if (idle) {
                evictions.incrementAndGet();
                log.debug("Evicted idle series {}", entry.getKey());
            }
            return idle;
        });
    }

    public void clear(String symbol) {
        seriesByKey.keySet().removeIf(key -> key.symbol().equals(symbol));
        log.info("🗑️ Cache cleared for {}", symbol);
    }

    public CacheStats stats() {
        long candles = seriesByKey.values().stream().mapToLong(CandleSeries::size).sum();
        return new CacheStats(
                hits.get(),
                misses.get(),
                fetches.get(),
                coalescedWaits.get(),
                staleServes.get(),
                evictions.get(),
                seriesByKey.size(),
                candles
        );
    }

    private boolean isFresh(CandleSeries series, Timeframe timeframe, int length, Instant now) {
        Candle last = series.last();
        if (last == null || series.size() < length) {
            return false;
        }
        Duration age = Duration.between(last.getOpenTime(), now);
        return age.compareTo(timeframe.getDuration()) <= 0;
    }

    private boolean withinTolerance(CandleSeries series, Instant now) {
        Candle last = series.last();
        if (last == null) {
            return false;
        }
        Duration staleness = Duration.between(last.closeTime(), now);
        return staleness.compareTo(properties.getStalenessTolerance()) <= 0;
    }

    private void awaitFetch(SeriesKey key, CandleSeries series, int length) {
        FutureTask<Integer> task = new FutureTask<>(() -> fetchAndMerge(key, series, length));
        Future<Integer> existing = inFlight.putIfAbsent(key, task);
        boolean owner = existing == null;
        Future<Integer> future = owner ? task : existing;
        if (owner) {
            try {
                fetchExecutor.execute(task);
            } catch (RejectedExecutionException ex) {
                inFlight.remove(key, task);
                task.cancel(false);
                log.warn("Candle fetch for {} rejected by executor: {}", key, ex.getMessage());
                throw new DataUnavailableException(key.symbol(), "Candle fetch rejected: fetch pool is saturated", ex);
            }
            fetches.incrementAndGet();
        } else {
            coalescedWaits.incrementAndGet();
            log.debug("Joining in-flight fetch for {}", key);
        }

        long timeoutMs = properties.getFetchTimeout().toMillis();
        try {
            future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            if (owner) {
                future.cancel(true);
            }
            throw new DataUnavailableException(key.symbol(), "Candle fetch timed out after " + timeoutMs + "ms");
        } catch (CancellationException ex) {
            throw new DataUnavailableException(key.symbol(), "Candle fetch was cancelled");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            if (owner) {
                future.cancel(true);
            }
            throw new DataUnavailableException(key.symbol(), "Interrupted while waiting for candles", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof PipelineException pipelineException) {
                throw pipelineException;
            }
            throw new DataUnavailableException(key.symbol(), "Candle fetch failed: " + cause.getMessage(), cause);
        } finally {
            if (owner) {
                inFlight.remove(key, task);
            }
        }
    }

    private Integer fetchAndMerge(SeriesKey key, CandleSeries series, int length) {
        Instant now = clock.instant();
        Candle last = series.last();
        Instant since = last != null && series.size() >= length
                ? last.getOpenTime()
                : now.minus(key.timeframe().getDuration().multipliedBy(length));

        List<Candle> fetched;
        try {
            fetched = RateLimiter.decorateSupplier(rateLimiter,
                    () -> candleSource.fetchCandles(key.symbol(), key.timeframe(), since)).get();
        } catch (RequestNotPermitted ex) {
            throw new RateLimitedException(key.symbol(), "Local rate limit exhausted for market data", ex);
        }

        List<Candle> accepted = fetched.stream()
                .filter(candle -> candle != null
                        && key.symbol().equals(candle.getSymbol())
                        && key.timeframe() == candle.getTimeframe())
                .toList();
        if (accepted.size() != fetched.size()) {
            log.warn("Dropped {} foreign candles from upstream for {}", fetched.size() - accepted.size(), key);
        }
        int dropped = series.merge(accepted, now);
        log.debug("Fetched {} candles for {} since={} droppedOldest={} size={}",
                accepted.size(), key, since, dropped, series.size());
        return accepted.size();
    }

    record SeriesKey(String symbol, Timeframe timeframe) {
        @Override
        public String toString() {
            return symbol + "/" + timeframe;
        }
    }
}
