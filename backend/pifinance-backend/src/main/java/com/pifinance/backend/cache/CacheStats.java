package com.pifinance.backend.cache;

import java.util.List;

public record CacheStats(
        boolean enabled,
        int cachedSymbols,
        long totalRequests,
        long cacheHits,
        long cacheMisses,
        double hitRatePercent,
        long totalRefreshes,
        long refreshErrors,
        int ttlDays,
        int refreshIntervalMinutes,
        List<String> symbols) {

    /**
     * Percentage of lookups served from the cache, rounded to two decimals; zero before any lookup.
     */
    static double hitRate(long hits, long misses) {
        long total = hits + misses;
        if (total == 0) {
            return 0.0;
        }
        return Math.round(hits * 10000.0 / total) / 100.0;
    }
}
