package com.flagship.fx_payments.config;

import com.flagship.fx_payments.fx.LiveRateSource;
import com.flagship.fx_payments.fx.MockRateSource;
import com.flagship.fx_payments.fx.RateSource;
import com.flagship.fx_payments.fx.RateSourceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Random;

/**
 * Wires the rate sources.
 *
 * The live provider is used only when {@code fx.provider.api-key} is set; otherwise
 * the mock source serves every quote. The mock bean exists in both modes because the
 * quote engine falls back to it when the provider fails and nothing is cached.
 */
@Configuration
@Slf4j
public class RateSourceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MockRateSource mockRateSource(Clock clock) {
        return new MockRateSource(clock, new Random());
    }

    @Bean
    public RetryTemplate liveRateRetryTemplate(FxProperties properties) {
        FxProperties.Retry retry = properties.getProvider().getRetry();

        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(retry.getInitialBackoff().toMillis());
        backOff.setMultiplier(retry.getMultiplier());
        backOff.setMaxInterval(retry.getMaxBackoff().toMillis());

        return rateSourceRetryTemplate(retry.getMaxAttempts(), backOff);
    }

    /**
     * Retries NETWORK and UNAVAILABLE failures up to {@code maxAttempts} calls in total.
     * Any other exception, including an invalid key or an exhausted quota, is rethrown
     * after the first attempt.
     */
    public static RetryTemplate rateSourceRetryTemplate(int maxAttempts, BackOffPolicy backOffPolicy) {
        RetryPolicy retryable = new SimpleRetryPolicy(maxAttempts);
        RetryPolicy never = new NeverRetryPolicy();

        ExceptionClassifierRetryPolicy policy = new ExceptionClassifierRetryPolicy();
        policy.setExceptionClassifier(throwable -> isRetryable(throwable) ? retryable : never);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(policy);
        template.setBackOffPolicy(backOffPolicy);
        return template;
    }

    @Bean
    public RestClient rateProviderRestClient(RestClient.Builder builder, FxProperties properties) {
        FxProperties.Provider provider = properties.getProvider();

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(provider.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(provider.getReadTimeout());

        return builder
                .baseUrl(provider.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Bean("activeRateSource")
    public RateSource activeRateSource(FxProperties properties,
                                       MockRateSource mockRateSource,
                                       @Qualifier("rateProviderRestClient") RestClient restClient,
                                       @Qualifier("liveRateRetryTemplate") RetryTemplate retryTemplate,
                                       Clock clock) {
        if (properties.isLiveMode()) {
            log.info("Rate source: LIVE ({}, pivot {})",
                    properties.getProvider().getBaseUrl(), properties.getProvider().getPivotCurrency());
            return new LiveRateSource(restClient, properties.getProvider(), retryTemplate, clock);
        }
        log.info("Rate source: MOCK (no fx.provider.api-key configured)");
        return mockRateSource;
    }

    /**
     * Pool for provider calls, so a slow provider is cut off at
     * {@code fx.quote.fetch-timeout} instead of holding the request thread.
     */
    @Bean("rateFetchExecutor")
    public ThreadPoolTaskExecutor rateFetchExecutor(FxProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getQuote().getFetchThreads());
        executor.setMaxPoolSize(properties.getQuote().getFetchThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("rate-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    private static boolean isRetryable(Throwable throwable) {
        return throwable instanceof RateSourceException
                && ((RateSourceException) throwable).getFailure().isRetryable();
    }
}
