package com.pifinance.backend.quote;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class YahooFinanceClientTest {

    private static final String BASE_URL = "https://query1.finance.yahoo.com";

    private MockRestServiceServer server;
    private YahooFinanceClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader("User-Agent", "pifinance-test");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new YahooFinanceClient(builder.build(), new ObjectMapper());
    }

    @Test
    void shouldMapQuoteResponseToSnapshot() {
        server.expect(requestTo(startsWith(BASE_URL + "/v7/finance/quote")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("symbols", "AAPL"))
                .andExpect(header("User-Agent", "pifinance-test"))
                .andRespond(withSuccess("""
                        {"quoteResponse": {"result": [{
                          "symbol": "AAPL",
                          "currency": "USD",
                          "regularMarketPrice": 222.91,
                          "regularMarketChange": -2.09,
                          "regularMarketChangePercent": -0.93,
                          "regularMarketVolume": 45123000,
                          "marketCap": {"raw": 3370000000000, "fmt": "3.37T"},
                          "regularMarketPreviousClose": 225.0,
                          "regularMarketOpen": 224.1,
                          "regularMarketDayHigh": 225.3,
                          "regularMarketDayLow": 221.8
                        }], "error": null}}
                        """, MediaType.APPLICATION_JSON));

        Optional<PriceSnapshot> snapshot = client.fetch("AAPL");

        server.verify();
        assertThat(snapshot).isPresent();
        PriceSnapshot quote = snapshot.get();
        assertThat(quote.symbol()).isEqualTo("AAPL");
        assertThat(quote.price()).isEqualTo(222.91);
        assertThat(quote.currency()).isEqualTo("USD");
        assertThat(quote.change()).isEqualTo(-2.09);
        assertThat(quote.volume()).isEqualTo(45_123_000L);
        assertThat(quote.marketCap()).isEqualTo(3.37e12);
        assertThat(quote.previousClose()).isEqualTo(225.0);
        assertThat(quote.dayLow()).isEqualTo(221.8);
        assertThat(quote.timestamp()).isNotNull();
    }

    @Test
    void shouldPreferCurrentPriceOverRegularMarketPrice() {
        server.expect(requestTo(startsWith(BASE_URL + "/v7/finance/quote")))
                .andRespond(withSuccess(
                        "{\"quoteResponse\":{\"result\":[{\"currentPrice\":10.5,\"regularMarketPrice\":9.0}]}}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.fetch("XYZ")).map(PriceSnapshot::price).contains(10.5);
    }

    @Test
    void shouldReturnEmptyForUnknownSymbolOrMissingPrice() {
        server.expect(requestTo(startsWith(BASE_URL + "/v7/finance/quote")))
                .andRespond(withSuccess("{\"quoteResponse\":{\"result\":[]}}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE_URL + "/v7/finance/quote")))
                .andRespond(withSuccess(
                        "{\"quoteResponse\":{\"result\":[{\"symbol\":\"DEAD\",\"regularMarketPrice\":0}]}}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE_URL + "/v7/finance/quote")))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.fetch("NOPE")).isEmpty();
        assertThat(client.fetch("DEAD")).isEmpty();
        assertThat(client.fetch("GONE")).isEmpty();
        server.verify();
    }

    @Test
    void shouldWrapUpstreamFailures() {
        server.expect(requestTo(startsWith(BASE_URL + "/v7/finance/quote"))).andRespond(withServerError());
        server.expect(requestTo(startsWith(BASE_URL + "/v7/finance/quote")))
                .andRespond(withSuccess("<html>rate limited</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> client.fetch("AAPL"))
                .isInstanceOf(MarketDataProviderException.class)
                .hasMessageContaining("AAPL");
        assertThatThrownBy(() -> client.fetch("AAPL"))
                .isInstanceOf(MarketDataProviderException.class)
                .hasMessageContaining("Unreadable");
    }

    @Test
    void shouldMapCompanyProfile() {
        server.expect(requestTo(startsWith(BASE_URL + "/v10/finance/quoteSummary/AAPL")))
                .andRespond(withSuccess("""
                        {"quoteSummary": {"result": [{
                          "assetProfile": {
                            "sector": "Technology",
                            "industry": "Consumer Electronics",
                            "website": "https://www.apple.com",
                            "country": "United States",
                            "fullTimeEmployees": 161000,
                            "longBusinessSummary": "Apple Inc. designs smartphones."
                          },
                          "price": {
                            "longName": "Apple Inc.",
                            "shortName": "Apple",
                            "marketCap": {"raw": 3370000000000, "fmt": "3.37T"}
                          }
                        }]}}
                        """, MediaType.APPLICATION_JSON));

        Optional<CompanyInfo> info = client.fetchCompanyInfo("AAPL");

        assertThat(info).isPresent();
        assertThat(info.get().name()).isEqualTo("Apple Inc.");
        assertThat(info.get().sector()).isEqualTo("Technology");
        assertThat(info.get().employees()).isEqualTo(161_000L);
        assertThat(info.get().marketCap()).isEqualTo(3.37e12);
    }

    @Test
    void shouldTreatSparseProfileAsMissing() {
        server.expect(requestTo(startsWith(BASE_URL + "/v10/finance/quoteSummary/ZZZZ")))
                .andRespond(withSuccess(
                        "{\"quoteSummary\":{\"result\":[{\"price\":{\"shortName\":\"ZZZZ\"}}]}}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.fetchCompanyInfo("ZZZZ")).isEmpty();
    }

    @Test
    void shouldMapChartToBarsInExchangeTimezone() {
        server.expect(requestTo(startsWith(BASE_URL + "/v8/finance/chart/AAPL")))
                .andExpect(queryParam("range", "5d"))
                .andExpect(queryParam("interval", "1d"))
                .andRespond(withSuccess("""
                        {"chart": {"result": [{
                          "meta": {"exchangeTimezoneName": "America/New_York"},
                          "timestamp": [1730467800, 1730730600],
                          "indicators": {"quote": [{
                            "open": [220.0, 221.0],
                            "high": [223.0, 224.5],
                            "low": [219.5, null],
                            "close": [222.0, 223.9],
                            "volume": [50000000, 41000000]
                          }]}
                        }]}}
                        """, MediaType.APPLICATION_JSON));

        List<HistoricalBar> bars = client.fetchHistory("AAPL", "5d", "1d");

        assertThat(bars).hasSize(2);
        assertThat(bars.get(0).date()).isEqualTo("2024-11-01 09:30:00");
        assertThat(bars.get(0).close()).isEqualTo(222.0);
        assertThat(bars.get(0).volume()).isEqualTo(50_000_000L);
        assertThat(bars.get(1).date()).isEqualTo("2024-11-04 09:30:00");
        assertThat(bars.get(1).low()).isNull();
    }

    @Test
    void shouldReturnNoBarsWhenChartIsEmpty() {
        server.expect(requestTo(startsWith(BASE_URL + "/v8/finance/chart/NOPE")))
                .andRespond(withSuccess("{\"chart\":{\"result\":[{\"meta\":{}}]}}", MediaType.APPLICATION_JSON));

        assertThat(client.fetchHistory("NOPE", "1mo", "1d")).isEmpty();
    }

    @Test
    void shouldReturnDividendsOldestFirst() {
        server.expect(requestTo(startsWith(BASE_URL + "/v8/finance/chart/KO")))
                .andExpect(queryParam("events", "div"))
                .andExpect(queryParam("range", "max"))
                .andRespond(withSuccess("""
                        {"chart": {"result": [{
                          "meta": {"exchangeTimezoneName": "America/New_York"},
                          "events": {"dividends": {
                            "1723469400": {"amount": 0.25, "date": 1723469400},
                            "1715347800": {"amount": 0.24, "date": 1715347800}
                          }}
                        }]}}
                        """, MediaType.APPLICATION_JSON));

        List<Dividend> dividends = client.fetchDividends("KO");

        assertThat(dividends).extracting(Dividend::date).containsExactly("2024-05-10", "2024-08-12");
        assertThat(dividends).extracting(Dividend::amount).containsExactly(0.24, 0.25);
    }

    @Test
    void shouldReturnNoDividendsWhenNoneWerePaid() {
        server.expect(requestTo(startsWith(BASE_URL + "/v8/finance/chart/TSLA")))
                .andRespond(withSuccess("{\"chart\":{\"result\":[{\"meta\":{}}]}}", MediaType.APPLICATION_JSON));

        assertThat(client.fetchDividends("TSLA")).isEmpty();
    }
}
