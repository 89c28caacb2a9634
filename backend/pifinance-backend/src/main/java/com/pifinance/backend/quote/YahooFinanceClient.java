package com.pifinance.backend.quote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link MarketDataProvider} backed by the public Yahoo Finance JSON endpoints.
 *
 * <p>Quotes come from {@code /v7/finance/quote}, company profiles from {@code /v10/finance/quoteSummary}
 * and both price history and dividends from {@code /v8/finance/chart}. An unknown symbol (HTTP 404 or an
 * empty result) yields an empty answer; transport and parse failures raise
 * {@link MarketDataProviderException}.
 */
public class YahooFinanceClient implements MarketDataProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(YahooFinanceClient.class);
    private static final DateTimeFormatter BAR_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter DIVIDEND_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final int MIN_PROFILE_FIELDS = 3;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public YahooFinanceClient(RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<PriceSnapshot> fetch(String symbol) {
        Optional<JsonNode> root = get("/v7/finance/quote?symbols={symbol}", symbol);
        if (root.isEmpty()) {
            return Optional.empty();
        }
        JsonNode quote = root.get().path("quoteResponse").path("result").path(0);
        if (quote.isMissingNode()) {
            return Optional.empty();
        }

        Double price = firstDouble(quote, "currentPrice", "regularMarketPrice");
        if (price == null || price <= 0) {
            LOGGER.debug("No usable price returned for {}", symbol);
            return Optional.empty();
        }
        return Optional.of(new PriceSnapshot(
                symbol,
                price,
                text(quote, "currency"),
                firstDouble(quote, "regularMarketChange"),
                firstDouble(quote, "regularMarketChangePercent"),
                firstLong(quote, "volume", "regularMarketVolume"),
                firstDouble(quote, "marketCap"),
                firstDouble(quote, "previousClose", "regularMarketPreviousClose"),
                firstDouble(quote, "open", "regularMarketOpen"),
                firstDouble(quote, "dayHigh", "regularMarketDayHigh"),
                firstDouble(quote, "dayLow", "regularMarketDayLow"),
                OffsetDateTime.now(ZoneOffset.UTC)));
    }

    @Override
    public Optional<CompanyInfo> fetchCompanyInfo(String symbol) {
        Optional<JsonNode> root = get("/v10/finance/quoteSummary/{symbol}?modules=assetProfile,price", symbol);
        if (root.isEmpty()) {
            return Optional.empty();
        }
        JsonNode result = root.get().path("quoteSummary").path("result").path(0);
        JsonNode profile = result.path("assetProfile");
        JsonNode price = result.path("price");

        String name = text(price, "longName");
        if (name == null) {
            name = text(price, "shortName");
        }
        CompanyInfo info = new CompanyInfo(
                symbol,
                name,
                text(profile, "sector"),
                text(profile, "industry"),
                text(profile, "website"),
                text(profile, "longBusinessSummary"),
                text(profile, "country"),
                firstLong(profile, "fullTimeEmployees"),
                firstDouble(price, "marketCap"));
        if (countPresent(info) < MIN_PROFILE_FIELDS) {
            return Optional.empty();
        }
        return Optional.of(info);
    }

    @Override
    public List<HistoricalBar> fetchHistory(String symbol, String period, String interval) {
        Optional<JsonNode> root =
                get("/v8/finance/chart/{symbol}?range={range}&interval={interval}", symbol, period, interval);
        if (root.isEmpty()) {
            return List.of();
        }
        JsonNode chart = root.get().path("chart").path("result").path(0);
        JsonNode timestamps = chart.path("timestamp");
        if (!timestamps.isArray() || timestamps.isEmpty()) {
            return List.of();
        }
        ZoneId zone = exchangeZone(chart);
        JsonNode quote = chart.path("indicators").path("quote").path(0);

        List<HistoricalBar> bars = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            Instant at = Instant.ofEpochSecond(timestamps.get(i).asLong());
            bars.add(new HistoricalBar(
                    BAR_DATE.format(at.atZone(zone)),
                    doubleAt(quote.path("open"), i),
                    doubleAt(quote.path("high"), i),
                    doubleAt(quote.path("low"), i),
                    doubleAt(quote.path("close"), i),
                    longAt(quote.path("volume"), i)));
        }
        return List.copyOf(bars);
    }

    @Override
    public List<Dividend> fetchDividends(String symbol) {
        Optional<JsonNode> root = get("/v8/finance/chart/{symbol}?range=max&interval=1d&events=div", symbol);
        if (root.isEmpty()) {
            return List.of();
        }
        JsonNode chart = root.get().path("chart").path("result").path(0);
        JsonNode events = chart.path("events").path("dividends");
        if (!events.isObject()) {
            return List.of();
        }
        ZoneId zone = exchangeZone(chart);

        List<JsonNode> entries = new ArrayList<>();
        events.elements().forEachRemaining(entries::add);
        entries.sort(Comparator.comparingLong(entry -> entry.path("date").asLong()));

        List<Dividend> dividends = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            if (!entry.path("amount").isNumber()) {
                continue;
            }
            Instant paidAt = Instant.ofEpochSecond(entry.path("date").asLong());
            dividends.add(new Dividend(DIVIDEND_DATE.format(paidAt.atZone(zone)), entry.path("amount").asDouble()));
        }
        return List.copyOf(dividends);
    }

    private Optional<JsonNode> get(String uriTemplate, Object... variables) {
        String body;
        try {
            body = restClient.get().uri(uriTemplate, variables).retrieve().body(String.class);
        } catch (HttpClientErrorException.NotFound ex) {
            LOGGER.debug("Yahoo Finance has no data at {} for {}", uriTemplate, variables[0]);
            return Optional.empty();
        } catch (RestClientException ex) {
            throw new MarketDataProviderException("Yahoo Finance request failed for " + variables[0], ex);
        }
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(body));
        } catch (JsonProcessingException ex) {
            throw new MarketDataProviderException("Unreadable Yahoo Finance response for " + variables[0], ex);
        }
    }

    private static ZoneId exchangeZone(JsonNode chart) {
        String zone = text(chart.path("meta"), "exchangeTimezoneName");
        if (zone == null) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException ex) {
            return ZoneOffset.UTC;
        }
    }

    private static int countPresent(CompanyInfo info) {
        int count = 0;
        Object[] fields = {
            info.name(), info.sector(), info.industry(), info.website(),
            info.description(), info.country(), info.employees(), info.marketCap()
        };
        for (Object field : fields) {
            if (field != null) {
                count++;
            }
        }
        return count;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isTextual() && !value.asText().isBlank()) {
            return value.asText();
        }
        return null;
    }

    /** Quote fields arrive either as plain numbers or as {@code {"raw": n, "fmt": "..."}}. */
    private static JsonNode number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isObject()) {
            value = value.path("raw");
        }
        return value.isNumber() ? value : null;
    }

    private static Double firstDouble(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = number(node, field);
            if (value != null) {
                return value.asDouble();
            }
        }
        return null;
    }

    private static Long firstLong(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = number(node, field);
            if (value != null) {
                return value.asLong();
            }
        }
        return null;
    }

    private static Double doubleAt(JsonNode array, int index) {
        JsonNode value = array.path(index);
        return value.isNumber() ? value.asDouble() : null;
    }

    private static Long longAt(JsonNode array, int index) {
        JsonNode value = array.path(index);
        return value.isNumber() ? value.asLong() : null;
    }
}
