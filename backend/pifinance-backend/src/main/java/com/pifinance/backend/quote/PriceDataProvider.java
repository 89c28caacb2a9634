package com.pifinance.backend.quote;

import java.util.Optional;

/**
 * Outbound capability used by both the on-demand quote path and the background refresh pass.
 */
@FunctionalInterface
public interface PriceDataProvider {

    /**
     * Fetches a fresh snapshot for the symbol.
     *
     * @return the snapshot, or empty when the source has no usable price for it
     * @throws MarketDataProviderException when the source cannot be reached or answers garbage
     */
    Optional<PriceSnapshot> fetch(String symbol);
}
