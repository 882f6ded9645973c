package com.flagship.fx_payments.fx;

import com.flagship.fx_payments.config.FxProperties;
import com.flagship.fx_payments.exception.ValidationException;
import com.flagship.fx_payments.fx.RateSourceException.Failure;
import com.flagship.fx_payments.observability.CorrelationContext;
import com.flagship.fx_payments.observability.QuoteMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Issues quotes.
 *
 * Rate resolution, in order:
 * <ol>
 *   <li>a fresh cached rate for the pair</li>
 *   <li>the active source, bounded by {@code fx.quote.fetch-timeout}; the result refreshes the cache</li>
 *   <li>on source failure, the last cached rate whatever its age (quote is degraded)</li>
 *   <li>with nothing cached, the synthetic source (quote is degraded)</li>
 * </ol>
 * Upstream trouble never fails a request; it is logged, counted and shows up only as the
 * degraded flag. Invalid input is the only hard failure.
 *
 * The set of quotable currencies is the synthetic source's table, so the last step
 * can always price a pair that passed validation.
 */
@Service
@Slf4j
public class QuoteEngine {

    private final RateSource activeSource;
    private final MockRateSource fallbackSource;
    private final QuoteCache quoteCache;
    private final QuotePersistenceService persistenceService;
    private final QuoteMetrics quoteMetrics;
    private final AsyncTaskExecutor fetchExecutor;
    private final FxProperties properties;
    private final Clock clock;

    public QuoteEngine(@Qualifier("activeRateSource") RateSource activeSource,
                       MockRateSource fallbackSource,
                       QuoteCache quoteCache,
                       QuotePersistenceService persistenceService,
                       QuoteMetrics quoteMetrics,
                       @Qualifier("rateFetchExecutor") AsyncTaskExecutor fetchExecutor,
                       FxProperties properties,
                       Clock clock) {
        this.activeSource = activeSource;
        this.fallbackSource = fallbackSource;
        this.quoteCache = quoteCache;
        this.persistenceService = persistenceService;
        this.quoteMetrics = quoteMetrics;
        this.fetchExecutor = fetchExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Issues a quote with the configured markup.
     */
    public Quote request(CurrencyPair pair) {
        return request(pair, properties.getMarkupPercentage());
    }

    /**
     * Issues a quote with an explicit markup.
     *
     * @param markupPercentage decimal markup between 0 (inclusive) and 1 (exclusive), at most six places
     * @throws ValidationException if the pair uses an unsupported currency or the markup is unusable
     */
    public Quote request(CurrencyPair pair, BigDecimal markupPercentage) {
        validate(pair, markupPercentage);

        RateResolution resolution = resolveRate(pair);
        Quote quote = Quote.issue(resolution.rate(), markupPercentage, clock.instant(),
            properties.getQuote().getValidity(), resolution.degraded());

        MDC.put(CorrelationContext.QUOTE_ID_MDC_KEY, quote.getId().toString());
        try {
            persistenceService.recordIssued(quote);
            quoteMetrics.recordQuoteIssued(quote.getRateSource(), quote.isDegraded());
            log.info("Issued quote for {}: base={}, markup={}, final={}, source={}, degraded={}, expiresAt={}",
                pair, quote.getBaseRate(), quote.getMarkupPercentage(), quote.getFinalRate(),
                quote.getRateSource(), quote.isDegraded(), quote.getExpiresAt());
            return quote;
        } finally {
            MDC.remove(CorrelationContext.QUOTE_ID_MDC_KEY);
        }
    }

    /**
     * Currency codes that can be quoted right now, sorted.
     *
     * Uses the cached symbol list when fresh, else asks the active source. If that fails,
     * the last known list is used, then the synthetic source's own table.
     */
    public List<String> supportedCurrencies() {
        Map<String, String> symbols = quoteCache.getSymbols().orElse(null);
        if (symbols == null) {
            try {
                symbols = callWithTimeout(activeSource::fetchSymbols);
                quoteCache.putSymbols(symbols);
            } catch (RateSourceException e) {
                quoteMetrics.recordSourceFailure(e.getFailure());
                log.warn("Symbol list unavailable from {} source ({}): {}",
                    activeSource.type(), e.getFailure(), e.getMessage());
                symbols = quoteCache.getLastKnownSymbols().orElse(null);
            }
        }
        if (symbols == null) {
            return fallbackSource.supportedCurrencies().stream().sorted().toList();
        }
        return symbols.keySet().stream()
            .filter(fallbackSource::supports)
            .sorted()
            .toList();
    }

    private RateResolution resolveRate(CurrencyPair pair) {
        var cached = quoteCache.get(pair);
        if (cached.isPresent()) {
            quoteMetrics.recordCacheHit();
            return new RateResolution(cached.get(), false);
        }
        quoteMetrics.recordCacheMiss();

        long startTime = System.currentTimeMillis();
        try {
            Rate fresh = callWithTimeout(() -> activeSource.fetch(pair));
            quoteCache.put(pair, fresh);
            quoteMetrics.recordSourceSuccess();
            return new RateResolution(fresh, false);
        } catch (RateSourceException e) {
            quoteMetrics.recordSourceFailure(e.getFailure());
            log.warn("Rate fetch for {} from {} source failed ({}): {}",
                pair, activeSource.type(), e.getFailure(), e.getMessage());
        } finally {
            quoteMetrics.recordFetchDuration(System.currentTimeMillis() - startTime);
        }

        var lastKnown = quoteCache.getLastKnown(pair);
        if (lastKnown.isPresent()) {
            quoteMetrics.recordStaleFallback();
            log.warn("Serving degraded quote for {} from stale rate fetched at {}",
                pair, lastKnown.get().getFetchedAt());
            return new RateResolution(lastKnown.get(), true);
        }

        quoteMetrics.recordSyntheticFallback();
        log.warn("No cached rate for {}; serving degraded quote from synthetic source", pair);
        return new RateResolution(fallbackSource.fetch(pair), true);
    }

    private <T> T callWithTimeout(Callable<T> call) {
        Duration timeout = properties.getQuote().getFetchTimeout();
        Future<T> future;
        try {
            future = fetchExecutor.submit(call);
        } catch (RejectedExecutionException e) {
            throw new RateSourceException(Failure.UNAVAILABLE, "Rate fetch executor is saturated", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RateSourceException(Failure.NETWORK, "Rate fetch timed out after " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RateSourceException(Failure.NETWORK, "Interrupted while waiting for rate fetch", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RateSourceException rateSourceException) {
                throw rateSourceException;
            }
            throw new RateSourceException(Failure.UNAVAILABLE,
                "Rate source failed unexpectedly: " + cause, cause);
        }
    }

    private void validate(CurrencyPair pair, BigDecimal markupPercentage) {
        if (pair == null) {
            throw new ValidationException("Currency pair is required");
        }
        for (String code : List.of(pair.getSource(), pair.getTarget())) {
            if (!fallbackSource.supports(code)) {
                throw new ValidationException("Unsupported currency: " + code);
            }
        }
        if (markupPercentage == null) {
            throw new ValidationException("Markup percentage is required");
        }
        if (markupPercentage.signum() < 0 || markupPercentage.compareTo(BigDecimal.ONE) >= 0) {
            throw new ValidationException("Markup percentage must be at least 0 and below 1: " + markupPercentage);
        }
        if (markupPercentage.stripTrailingZeros().scale() > 6) {
            throw new ValidationException("Markup percentage allows at most six decimal places: " + markupPercentage);
        }
    }

    private record RateResolution(Rate rate, boolean degraded) {
    }
}
