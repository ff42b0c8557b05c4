package com.meridian.backend.service.marketdata;

public record CacheStats(
        long hits,
        long misses,
        long fetches,
        long coalescedWaits,
        long staleServes,
        long evictions,
        int seriesCached,
        long candlesCached
) {
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
