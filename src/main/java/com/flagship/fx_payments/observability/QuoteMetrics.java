package com.flagship.fx_payments.observability;

import com.flagship.fx_payments.fx.RateSourceException;
import com.flagship.fx_payments.fx.RateSourceType;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Metrics for quoting and the rate sources behind it.
 *
 * Metrics exposed:
 * - quotes.issued: quotes issued, tagged by rate source and degraded flag
 * - quotes.rate.cache: cache lookups, tagged hit/miss
 * - quotes.rate.fallback: degraded quotes, tagged by fallback kind (stale_cache, synthetic)
 * - rate.source.failures: upstream failures, tagged by failure category
 * - rate.source.fetch.duration: time spent waiting for the active source
 * - quotes.rate.cache.pairs: currency pairs currently held in the rate cache
 */
@Component
public class QuoteMetrics {

    private final MeterRegistry registry;
    private final Timer fetchTimer;
    private final AtomicLong cachedPairs = new AtomicLong(0);

    // Last outcome of the active source, read by the health indicator.
    private final AtomicReference<Instant> lastSourceSuccess = new AtomicReference<>();
    private final AtomicReference<Instant> lastSourceFailure = new AtomicReference<>();
    private final AtomicReference<RateSourceException.Failure> lastFailureKind = new AtomicReference<>();

    public QuoteMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.fetchTimer = Timer.builder("rate.source.fetch.duration")
                .description("Time spent fetching a rate from the active source")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        Gauge.builder("quotes.rate.cache.pairs", cachedPairs, AtomicLong::get)
                .description("Currency pairs held in the rate cache")
                .register(registry);
    }

    public void updateCachedPairs(int pairs) {
        cachedPairs.set(pairs);
    }

    public void recordQuoteIssued(RateSourceType source, boolean degraded) {
        registry.counter("quotes.issued",
                "source", source.name().toLowerCase(),
                "degraded", String.valueOf(degraded)
        ).increment();
    }

    public void recordCacheHit() {
        registry.counter("quotes.rate.cache", "result", "hit").increment();
    }

    public void recordCacheMiss() {
        registry.counter("quotes.rate.cache", "result", "miss").increment();
    }

    public void recordStaleFallback() {
        registry.counter("quotes.rate.fallback", "kind", "stale_cache").increment();
    }

    public void recordSyntheticFallback() {
        registry.counter("quotes.rate.fallback", "kind", "synthetic").increment();
    }

    public void recordSourceSuccess() {
        lastSourceSuccess.set(Instant.now());
    }

    public void recordSourceFailure(RateSourceException.Failure failure) {
        registry.counter("rate.source.failures", "failure", failure.name().toLowerCase()).increment();
        lastSourceFailure.set(Instant.now());
        lastFailureKind.set(failure);
    }

    public Instant getLastSourceSuccess() {
        return lastSourceSuccess.get();
    }

    public Instant getLastSourceFailure() {
        return lastSourceFailure.get();
    }

    public RateSourceException.Failure getLastFailureKind() {
        return lastFailureKind.get();
    }

    public void recordFetchDuration(long durationMs) {
        fetchTimer.record(Duration.ofMillis(durationMs));
    }
}
