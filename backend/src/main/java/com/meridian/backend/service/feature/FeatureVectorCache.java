package com.meridian.backend.service.feature;

import com.meridian.backend.config.FeatureProperties;
import com.meridian.backend.model.Candle;
import com.meridian.backend.model.FeatureVector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived memo of computed vectors keyed by symbol and the minute of the window's
 * last candle. A forming candle updated within the TTL keeps the earlier vector.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FeatureVectorCache {

    private final FeatureEngine featureEngine;
    private final FeatureProperties properties;
    private final Clock clock;

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();

    public FeatureVector computeIfAbsent(List<Candle> window) {
        if (window == null || window.isEmpty()) {
            return featureEngine.compute(window);
        }
        Candle last = window.get(window.size() - 1);
        Key key = new Key(last.getSymbol(), last.getOpenTime().truncatedTo(ChronoUnit.MINUTES));
        Instant now = clock.instant();

        Entry cached = entries.get(key);
        if (cached != null && cached.expiresAt().isAfter(now)) {
            log.debug("Feature cache hit symbol={} asOf={}", key.symbol(), key.minute());
            return cached.vector();
        }
        FeatureVector vector = featureEngine.compute(window);
        entries.put(key, new Entry(vector, now.plus(properties.getCacheTtl())));
        return vector;
    }

    @Scheduled(fixedDelayString = "${meridian.features.cache-ttl:PT90S}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.expiresAt().isAfter(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Purged {} expired feature vectors", removed);
        }
    }

    public int size() {
        return entries.size();
    }

    private record Key(String symbol, Instant minute) {}

    private record Entry(FeatureVector vector, Instant expiresAt) {}
}
