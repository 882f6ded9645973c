package com.flagship.fx_payments.config;

import com.flagship.fx_payments.fx.MockRateSource;
import com.flagship.fx_payments.fx.RateSource;
import com.flagship.fx_payments.fx.RateSourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Bean wiring for rate sources and the fetch pool.
 */
class RateSourceConfigTest {

    private final RateSourceConfig config = new RateSourceConfig();

    @Test
    @DisplayName("The fetch pool is left for the container to start, exactly once")
    void testRateFetchExecutor_StartedByContainerOnly() {
        FxProperties properties = new FxProperties();
        properties.getQuote().setFetchThreads(3);

        ThreadPoolTaskExecutor executor = config.rateFetchExecutor(properties);
        assertThrows(IllegalStateException.class, executor::getThreadPoolExecutor,
            "bean method must not start the pool itself");

        executor.afterPropertiesSet();
        try {
            assertEquals(3, executor.getThreadPoolExecutor().getCorePoolSize());
            assertEquals(3, executor.getThreadPoolExecutor().getMaximumPoolSize());
            assertTrue(executor.getThreadNamePrefix().startsWith("rate-fetch-"));
        } finally {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("No API key selects the mock source")
    void testActiveRateSource_MockWithoutKey() {
        FxProperties properties = new FxProperties();
        Clock clock = Clock.systemUTC();
        MockRateSource mock = config.mockRateSource(clock);

        RateSource active = config.activeRateSource(properties, mock,
            RestClient.builder().baseUrl("http://localhost").build(), new RetryTemplate(), clock);

        assertSame(mock, active);
        assertEquals(RateSourceType.MOCK, active.type());
    }
}
