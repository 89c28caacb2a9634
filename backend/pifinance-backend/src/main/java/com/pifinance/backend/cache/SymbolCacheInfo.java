package com.pifinance.backend.cache;

import com.pifinance.backend.quote.PriceSnapshot;
import java.time.Instant;

public record SymbolCacheInfo(
        String symbol,
        Double price,
        boolean cached,
        Instant lastRequested,
        Instant lastRefreshed,
        PriceSnapshot data) {}
