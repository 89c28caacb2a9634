package com.pifinance.backend.quote;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.OffsetDateTime;

/**
 * Point-in-time quote for one ticker. Immutable, so a cached instance can be handed to any number
 * of callers without copying.
 */
public record PriceSnapshot(
        String symbol,
        Double price,
        String currency,
        Double change,
        Double changePercent,
        Long volume,
        Double marketCap,
        Double previousClose,
        Double open,
        Double dayHigh,
        Double dayLow,
        OffsetDateTime timestamp) {

    /** A price is usable when present, finite and strictly positive. */
    @JsonIgnore
    public boolean hasUsablePrice() {
        return price != null && Double.isFinite(price) && price > 0;
    }
}
