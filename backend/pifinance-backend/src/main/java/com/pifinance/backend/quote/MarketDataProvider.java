package com.pifinance.backend.quote;

import java.util.List;
import java.util.Optional;

/**
 * Full read surface of the upstream market-data source. Only {@link #fetch(String)} feeds the price
 * cache; the other lookups are passed through uncached.
 */
public interface MarketDataProvider extends PriceDataProvider {

    Optional<CompanyInfo> fetchCompanyInfo(String symbol);

    /**
     * Returns price bars for the symbol, oldest first. An empty list means the source has no history
     * for the requested range.
     */
    List<HistoricalBar> fetchHistory(String symbol, String period, String interval);

    /**
     * Returns paid dividends, oldest first.
     */
    List<Dividend> fetchDividends(String symbol);
}
