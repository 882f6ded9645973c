package com.flagship.fx_payments.fx;

import com.flagship.fx_payments.config.FxProperties;
import com.flagship.fx_payments.config.RateSourceConfig;
import com.flagship.fx_payments.fx.RateSourceException.Failure;
import com.flagship.fx_payments.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.retry.backoff.NoBackOffPolicy;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Map;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Live provider client against a mocked HTTP server: triangulation, error mapping and retries.
 */
class LiveRateSourceTest {

    private static final String BASE_URL = "http://provider.test/api";

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

    private MockRestServiceServer server;
    private LiveRateSource source;

    @BeforeEach
    void setUp() {
        FxProperties.Provider provider = new FxProperties.Provider();
        provider.setApiKey("test-key");
        provider.setBaseUrl(BASE_URL);
        provider.setPivotCurrency("EUR");

        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();

        source = new LiveRateSource(builder.build(), provider,
            RateSourceConfig.rateSourceRetryTemplate(3, new NoBackOffPolicy()), clock);
    }

    @Test
    @DisplayName("Cross rate is triangulated through the pivot")
    void testFetch_TriangulatesThroughPivot() {
        server.expect(requestTo(startsWith(BASE_URL + "/latest")))
            .andExpect(method(HttpMethod.GET))
            .andExpect(queryParam("access_key", "test-key"))
            .andExpect(queryParam("base", "EUR"))
            .andExpect(queryParam("symbols", "GBP,USD"))
            .andRespond(withSuccess("""
                {"success": true, "timestamp": 1714557600, "base": "EUR",
                 "rates": {"GBP": 0.8584, "USD": 1.0918}}
                """, MediaType.APPLICATION_JSON));

        Rate rate = source.fetch(CurrencyPair.of("GBP", "USD"));

        assertEquals(new BigDecimal("1.27190121"), rate.getMidRate().setScale(8, RoundingMode.HALF_EVEN));
        assertEquals(RateSourceType.LIVE, rate.getSource());
        assertEquals(clock.instant(), rate.getFetchedAt());
        server.verify();
    }

    @Test
    @DisplayName("Pair involving the pivot asks only for the other currency")
    void testFetch_PivotAsSource() {
        server.expect(requestTo(startsWith(BASE_URL + "/latest")))
            .andExpect(queryParam("symbols", "USD"))
            .andRespond(withSuccess("""
                {"success": true, "base": "EUR", "rates": {"USD": 1.0918}}
                """, MediaType.APPLICATION_JSON));

        Rate rate = source.fetch(CurrencyPair.of("EUR", "USD"));

        assertEquals(0, new BigDecimal("1.0918").compareTo(rate.getMidRate()));
        server.verify();
    }

    @Test
    @DisplayName("Provider error 101 maps to INVALID_KEY and is not retried")
    void testFetch_InvalidKeyNotRetried() {
        server.expect(ExpectedCount.once(), requestTo(startsWith(BASE_URL + "/latest")))
            .andRespond(withSuccess("""
                {"success": false, "error": {"code": 101, "type": "invalid_access_key",
                 "info": "You have not supplied a valid API Access Key."}}
                """, MediaType.APPLICATION_JSON));

        RateSourceException e = assertThrows(RateSourceException.class,
            () -> source.fetch(CurrencyPair.of("GBP", "USD")));

        assertEquals(Failure.INVALID_KEY, e.getFailure());
        server.verify();
    }

    @Test
    @DisplayName("Exhausted quota maps to RATE_LIMITED and is not retried")
    void testFetch_UsageLimitNotRetried() {
        server.expect(ExpectedCount.once(), requestTo(startsWith(BASE_URL + "/latest")))
            .andRespond(withSuccess("""
                {"success": false, "error": {"code": 104, "type": "usage_limit_reached"}}
                """, MediaType.APPLICATION_JSON));

        RateSourceException e = assertThrows(RateSourceException.class,
            () -> source.fetch(CurrencyPair.of("GBP", "USD")));

        assertEquals(Failure.RATE_LIMITED, e.getFailure());
        server.verify();
    }

    @Test
    @DisplayName("HTTP 401 maps to INVALID_KEY, HTTP 429 to RATE_LIMITED")
    void testFetch_HttpStatusMapping() {
        server.expect(ExpectedCount.once(), requestTo(startsWith(BASE_URL + "/latest")))
            .andRespond(withStatus(HttpStatus.UNAUTHORIZED));
        server.expect(ExpectedCount.once(), requestTo(startsWith(BASE_URL + "/latest")))
            .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        RateSourceException unauthorized = assertThrows(RateSourceException.class,
            () -> source.fetch(CurrencyPair.of("GBP", "USD")));
        RateSourceException throttled = assertThrows(RateSourceException.class,
            () -> source.fetch(CurrencyPair.of("GBP", "USD")));

        assertEquals(Failure.INVALID_KEY, unauthorized.getFailure());
        assertEquals(Failure.RATE_LIMITED, throttled.getFailure());
        server.verify();
    }

    @Test
    @DisplayName("Server errors are retried up to the attempt limit")
    void testFetch_ServerErrorRetriedThenFails() {
        server.expect(ExpectedCount.times(3), requestTo(startsWith(BASE_URL + "/latest")))
            .andRespond(withServerError());

        RateSourceException e = assertThrows(RateSourceException.class,
            () -> source.fetch(CurrencyPair.of("GBP", "USD")));

        assertEquals(Failure.UNAVAILABLE, e.getFailure());
        server.verify();
    }

    @Test
    @DisplayName("A transient failure followed by success returns the rate")
    void testFetch_RecoversOnRetry() {
        server.expect(ExpectedCount.once(), requestTo(startsWith(BASE_URL + "/latest")))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(ExpectedCount.once(), requestTo(startsWith(BASE_URL + "/latest")))
            .andRespond(withSuccess("""
                {"success": true, "base": "EUR", "rates": {"GBP": 0.8584, "USD": 1.0918}}
                """, MediaType.APPLICATION_JSON));

        Rate rate = source.fetch(CurrencyPair.of("GBP", "USD"));

        assertTrue(rate.getMidRate().signum() > 0);
        server.verify();
    }

    @Test
    @DisplayName("A response without the requested rate is UNAVAILABLE")
    void testFetch_MissingRate() {
        server.expect(ExpectedCount.times(3), requestTo(startsWith(BASE_URL + "/latest")))
            .andRespond(withSuccess("""
                {"success": true, "base": "EUR", "rates": {"GBP": 0.8584}}
                """, MediaType.APPLICATION_JSON));

        RateSourceException e = assertThrows(RateSourceException.class,
            () -> source.fetch(CurrencyPair.of("GBP", "USD")));

        assertEquals(Failure.UNAVAILABLE, e.getFailure());
        server.verify();
    }

    @Test
    void testFetchSymbols_ReturnsProviderSymbols() {
        server.expect(requestTo(startsWith(BASE_URL + "/symbols")))
            .andExpect(queryParam("access_key", "test-key"))
            .andRespond(withSuccess("""
                {"success": true, "symbols": {"EUR": "Euro", "GBP": "British Pound Sterling"}}
                """, MediaType.APPLICATION_JSON));

        Map<String, String> symbols = source.fetchSymbols();

        assertEquals(2, symbols.size());
        assertEquals("Euro", symbols.get("EUR"));
        server.verify();
    }
}
