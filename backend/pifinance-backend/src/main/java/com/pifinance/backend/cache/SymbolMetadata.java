package com.pifinance.backend.cache;

import java.time.Instant;

/**
 * Recency bookkeeping for one symbol. Only ever touched while the owning cache holds its lock.
 */
final class SymbolMetadata {

    private Instant lastRequested;
    private Instant lastRefreshed;

    Instant getLastRequested() {
        return lastRequested;
    }

    void markRequested(Instant at) {
        this.lastRequested = at;
    }

    Instant getLastRefreshed() {
        return lastRefreshed;
    }

    void markRefreshed(Instant at) {
        this.lastRefreshed = at;
    }

    boolean isRequestedAfter(Instant cutoff) {
        return lastRequested != null && lastRequested.isAfter(cutoff);
    }
}
