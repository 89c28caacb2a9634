package com.pifinance.backend.quote;

import com.pifinance.backend.cache.PriceCache;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class QuoteService {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuoteService.class);

    static final int MAX_BATCH_SYMBOLS = 50;
    static final int MAX_DIVIDENDS = 100;
    static final String DEFAULT_PERIOD = "1mo";
    static final String DEFAULT_INTERVAL = "1d";

    private static final Set<String> PERIODS =
            Set.of("1d", "5d", "1mo", "3mo", "6mo", "1y", "2y", "5y", "10y", "ytd", "max");
    private static final Set<String> INTERVALS =
            Set.of("1m", "2m", "5m", "15m", "30m", "60m", "90m", "1h", "1d", "5d", "1wk", "1mo", "3mo");

    private final PriceCache priceCache;
    private final MarketDataProvider marketDataProvider;

    public QuoteService(PriceCache priceCache, MarketDataProvider marketDataProvider) {
        this.priceCache = priceCache;
        this.marketDataProvider = marketDataProvider;
    }

    /**
     * Serves the quote from the cache when present, otherwise fetches it upstream and caches it.
     */
    public PriceSnapshot getQuote(String rawSymbol) {
        String symbol = normalize(rawSymbol);
        return lookup(symbol)
                .orElseThrow(() -> new QuoteNotFoundException("No data found for symbol: " + symbol));
    }

    public QuoteBatch getQuotes(String rawSymbols) {
        Set<String> symbols = new LinkedHashSet<>();
        if (rawSymbols != null) {
            for (String part : rawSymbols.split(",")) {
                if (!part.isBlank()) {
                    symbols.add(PriceCache.normalizeSymbol(part));
                }
            }
        }
        if (symbols.isEmpty()) {
            throw new QuoteValidationException("No symbols provided");
        }
        if (symbols.size() > MAX_BATCH_SYMBOLS) {
            throw new QuoteValidationException("Maximum " + MAX_BATCH_SYMBOLS + " symbols allowed");
        }

        List<BatchQuote> quotes = new ArrayList<>();
        for (String symbol : symbols) {
            try {
                lookup(symbol).map(BatchQuote::of).ifPresent(quotes::add);
            } catch (MarketDataProviderException ex) {
                LOGGER.warn("Error fetching {}: {}", symbol, ex.getMessage());
                quotes.add(BatchQuote.failed(symbol, ex.getMessage()));
            }
        }
        return new QuoteBatch(List.copyOf(quotes), quotes.size());
    }

    public CompanyInfo getCompanyInfo(String rawSymbol) {
        String symbol = normalize(rawSymbol);
        return marketDataProvider.fetchCompanyInfo(symbol)
                .orElseThrow(() -> new QuoteNotFoundException("No company info found for symbol: " + symbol));
    }

    public PriceHistory getHistory(HistoryRequest request) {
        if (request == null) {
            throw new QuoteValidationException("Request body is required");
        }
        String symbol = normalize(request.symbol());
        String period = request.period() == null ? DEFAULT_PERIOD : request.period().trim();
        String interval = request.interval() == null ? DEFAULT_INTERVAL : request.interval().trim();
        if (!PERIODS.contains(period)) {
            throw new QuoteValidationException("Invalid period: " + period);
        }
        if (!INTERVALS.contains(interval)) {
            throw new QuoteValidationException("Invalid interval: " + interval);
        }

        List<HistoricalBar> bars = marketDataProvider.fetchHistory(symbol, period, interval);
        if (bars.isEmpty()) {
            throw new QuoteNotFoundException("No historical data found for " + symbol);
        }
        return new PriceHistory(symbol, period, interval, bars);
    }

    public DividendHistory getDividends(String rawSymbol) {
        String symbol = normalize(rawSymbol);
        List<Dividend> dividends = marketDataProvider.fetchDividends(symbol);
        if (dividends.isEmpty()) {
            return new DividendHistory(symbol, List.of(), "No dividend data available");
        }
        int from = Math.max(dividends.size() - MAX_DIVIDENDS, 0);
        return new DividendHistory(symbol, List.copyOf(dividends.subList(from, dividends.size())), null);
    }

    private Optional<PriceSnapshot> lookup(String symbol) {
        Optional<PriceSnapshot> cached = priceCache.get(symbol);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<PriceSnapshot> fetched = marketDataProvider.fetch(symbol).filter(PriceSnapshot::hasUsablePrice);
        fetched.ifPresent(snapshot -> priceCache.set(symbol, snapshot));
        return fetched;
    }

    private static String normalize(String rawSymbol) {
        if (rawSymbol == null || rawSymbol.isBlank()) {
            throw new QuoteValidationException("Symbol is required");
        }
        return PriceCache.normalizeSymbol(rawSymbol);
    }
}
