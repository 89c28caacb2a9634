package com.pifinance.backend.cache;

import com.pifinance.backend.quote.PriceDataProvider;
import com.pifinance.backend.quote.PriceSnapshot;
import com.pifinance.backend.util.TimeProvider;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory price cache keyed by upper-cased ticker symbol.
 *
 * <p>Which symbols are kept warm is learned from traffic: every {@link #get(String)} records a
 * visit, and {@link #refreshAll()} re-fetches every symbol visited within the TTL window while
 * evicting the rest. Snapshots and their metadata live in two maps guarded by a single lock, so a
 * snapshot never exists without its metadata. Calls to the {@link PriceDataProvider} are always made
 * outside that lock.
 */
public class PriceCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(PriceCache.class);

    private final boolean enabled;
    private final int ttlDays;
    private final int refreshIntervalMinutes;
    private final Duration refreshDelay;
    private final PriceDataProvider provider;
    private final TimeProvider timeProvider;

    private final Object lock = new Object();
    private final Map<String, PriceSnapshot> snapshots = new LinkedHashMap<>();
    private final Map<String, SymbolMetadata> metadata = new LinkedHashMap<>();

    private long hits;
    private long misses;
    private long refreshes;
    private long refreshErrors;

    public PriceCache(PriceCacheProperties properties, PriceDataProvider provider, TimeProvider timeProvider) {
        if (properties.getTtlDays() < 0) {
            throw new IllegalArgumentException("pifinance.cache.ttl-days must not be negative");
        }
        if (properties.getRefreshIntervalMinutes() <= 0) {
            throw new IllegalArgumentException("pifinance.cache.refresh-interval-minutes must be greater than zero");
        }
        if (properties.getRefreshDelay().isNegative()) {
            throw new IllegalArgumentException("pifinance.cache.refresh-delay must not be negative");
        }
        this.enabled = properties.isEnabled();
        this.ttlDays = properties.getTtlDays();
        this.refreshIntervalMinutes = properties.getRefreshIntervalMinutes();
        this.refreshDelay = properties.getRefreshDelay();
        this.provider = provider;
        this.timeProvider = timeProvider;
        LOGGER.info(
                "Price cache initialized: enabled={}, ttl={} days, refreshInterval={} min",
                enabled,
                ttlDays,
                refreshIntervalMinutes);
    }

    /**
     * Looks up a symbol. The visit is recorded before the lookup, so a miss still makes the symbol
     * eligible for background refresh.
     */
    public Optional<PriceSnapshot> get(String symbol) {
        if (!enabled) {
            return Optional.empty();
        }
        String key = normalizeSymbol(symbol);
        synchronized (lock) {
            metadata.computeIfAbsent(key, ignored -> new SymbolMetadata()).markRequested(timeProvider.now());
            PriceSnapshot snapshot = snapshots.get(key);
            if (snapshot != null) {
                hits++;
                LOGGER.debug("Cache HIT for {}", key);
                return Optional.of(snapshot);
            }
            misses++;
            LOGGER.debug("Cache MISS for {}", key);
            return Optional.empty();
        }
    }

    public void set(String symbol, PriceSnapshot snapshot) {
        if (!enabled) {
            return;
        }
        String key = normalizeSymbol(symbol);
        synchronized (lock) {
            Instant now = timeProvider.now();
            snapshots.put(key, snapshot);
            SymbolMetadata meta = metadata.computeIfAbsent(key, ignored -> new SymbolMetadata());
            meta.markRefreshed(now);
            meta.markRequested(now);
        }
        LOGGER.debug("Cached data for {}", key);
    }

    /**
     * Returns the symbols requested within the TTL window, in first-seen order. Every symbol outside
     * the window is evicted from both tables as part of the same call.
     */
    public List<String> getSymbolsToRefresh() {
        if (!enabled) {
            return List.of();
        }
        List<String> eligible = new ArrayList<>();
        List<String> expired = new ArrayList<>();
        synchronized (lock) {
            Instant cutoff = timeProvider.now().minus(Duration.ofDays(ttlDays));
            Iterator<Map.Entry<String, SymbolMetadata>> iterator = metadata.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, SymbolMetadata> entry = iterator.next();
                if (entry.getValue().isRequestedAfter(cutoff)) {
                    eligible.add(entry.getKey());
                } else {
                    iterator.remove();
                    snapshots.remove(entry.getKey());
                    expired.add(entry.getKey());
                }
            }
        }
        for (String symbol : expired) {
            LOGGER.info("Removing expired symbol from cache: {}", symbol);
        }
        return eligible;
    }

    /**
     * Re-fetches every eligible symbol one at a time, pausing between fetches. A failed fetch leaves
     * the previous snapshot in place.
     */
    public RefreshSummary refreshAll() {
        if (!enabled) {
            return RefreshSummary.empty();
        }
        List<String> symbols = getSymbolsToRefresh();
        if (symbols.isEmpty()) {
            LOGGER.debug("No symbols to refresh");
            return RefreshSummary.empty();
        }

        LOGGER.info("Refreshing {} cached symbols: {}", symbols.size(), String.join(", ", symbols));
        int refreshed = 0;
        int failed = 0;
        for (int i = 0; i < symbols.size(); i++) {
            if (i > 0 && !pause()) {
                LOGGER.info("Refresh pass interrupted after {} of {} symbols", i, symbols.size());
                break;
            }
            String symbol = symbols.get(i);
            Optional<PriceSnapshot> fresh = fetchQuietly(symbol);
            if (fresh.isPresent()) {
                if (commitRefresh(symbol, fresh.get())) {
                    refreshed++;
                    LOGGER.debug("Refreshed {}: {}", symbol, fresh.get().price());
                }
            } else {
                recordRefreshError();
                failed++;
            }
        }

        LOGGER.info(
                "Refresh completed: {} successful, {} errors out of {} symbols",
                refreshed,
                failed,
                symbols.size());
        return new RefreshSummary(symbols.size(), refreshed, failed);
    }

    public CacheStats getStats() {
        synchronized (lock) {
            return new CacheStats(
                    enabled,
                    snapshots.size(),
                    hits + misses,
                    hits,
                    misses,
                    CacheStats.hitRate(hits, misses),
                    refreshes,
                    refreshErrors,
                    ttlDays,
                    refreshIntervalMinutes,
                    List.copyOf(snapshots.keySet()));
        }
    }

    /**
     * Diagnostic view of one cached symbol. Does not count as a request, so it never extends the
     * symbol's TTL.
     */
    public Optional<SymbolCacheInfo> getSymbolInfo(String symbol) {
        if (!enabled) {
            return Optional.empty();
        }
        String key = normalizeSymbol(symbol);
        synchronized (lock) {
            PriceSnapshot snapshot = snapshots.get(key);
            if (snapshot == null) {
                return Optional.empty();
            }
            SymbolMetadata meta = metadata.get(key);
            return Optional.of(new SymbolCacheInfo(
                    key,
                    snapshot.price(),
                    true,
                    meta.getLastRequested(),
                    meta.getLastRefreshed(),
                    snapshot));
        }
    }

    public int clear() {
        int count;
        synchronized (lock) {
            count = snapshots.size();
            snapshots.clear();
            metadata.clear();
        }
        LOGGER.info("Cache cleared: {} symbols removed", count);
        return count;
    }

    public boolean removeSymbol(String symbol) {
        String key = normalizeSymbol(symbol);
        synchronized (lock) {
            if (!snapshots.containsKey(key)) {
                return false;
            }
            snapshots.remove(key);
            metadata.remove(key);
        }
        LOGGER.info("Removed {} from cache", key);
        return true;
    }

    private Optional<PriceSnapshot> fetchQuietly(String symbol) {
        try {
            Optional<PriceSnapshot> fetched = provider.fetch(symbol);
            if (fetched.isPresent() && fetched.get().hasUsablePrice()) {
                return fetched;
            }
            LOGGER.warn("Failed to refresh {}: no data returned", symbol);
        } catch (RuntimeException ex) {
            LOGGER.warn("Error refreshing {}: {}", symbol, ex.getMessage(), ex);
        }
        return Optional.empty();
    }

    private boolean commitRefresh(String symbol, PriceSnapshot snapshot) {
        synchronized (lock) {
            SymbolMetadata meta = metadata.get(symbol);
            if (meta == null) {
                LOGGER.debug("Discarding refresh for {}: removed while fetching", symbol);
                return false;
            }
            snapshots.put(symbol, snapshot);
            meta.markRefreshed(timeProvider.now());
            refreshes++;
            return true;
        }
    }

    private void recordRefreshError() {
        synchronized (lock) {
            refreshErrors++;
        }
    }

    private boolean pause() {
        try {
            timeProvider.sleep(refreshDelay);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Canonical cache key for a ticker: trimmed and upper-cased.
     */
    public static String normalizeSymbol(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol must not be null");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
