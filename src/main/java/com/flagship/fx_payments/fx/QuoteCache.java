package com.flagship.fx_payments.fx;

import com.flagship.fx_payments.config.FxProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory cache of rates per pair and of the provider's symbol list.
 *
 * Freshness is measured from the rate's own {@code fetchedAt} against the
 * injected clock. Stale entries are kept: {@link #get} never returns them, but
 * {@link #getLastKnown} does, for the degraded fallback path. Writes are
 * last-writer-wins per pair.
 */
@Component
@Slf4j
public class QuoteCache {

    private final ConcurrentMap<CurrencyPair, Rate> rates = new ConcurrentHashMap<>();
    private final AtomicReference<CachedSymbols> symbols = new AtomicReference<>();

    private final Clock clock;
    private final Duration rateTtl;
    private final Duration symbolTtl;

    @Autowired
    public QuoteCache(FxProperties properties, Clock clock) {
        this(clock, properties.getCache().getRateTtl(), properties.getCache().getSymbolTtl());
    }

    public QuoteCache(Clock clock, Duration rateTtl, Duration symbolTtl) {
        this.clock = clock;
        this.rateTtl = rateTtl;
        this.symbolTtl = symbolTtl;
    }

    public Optional<Rate> get(CurrencyPair pair) {
        Rate rate = rates.get(pair);
        if (rate == null || !isFresh(rate.getFetchedAt(), rateTtl)) {
            return Optional.empty();
        }
        return Optional.of(rate);
    }

    public Optional<Rate> getLastKnown(CurrencyPair pair) {
        return Optional.ofNullable(rates.get(pair));
    }

    public void put(CurrencyPair pair, Rate rate) {
        rates.put(pair, rate);
        log.debug("Cached {} rate for {} fetched at {}", rate.getSource(), pair, rate.getFetchedAt());
    }

    public Optional<Map<String, String>> getSymbols() {
        CachedSymbols cached = symbols.get();
        if (cached == null || !isFresh(cached.cachedAt(), symbolTtl)) {
            return Optional.empty();
        }
        return Optional.of(cached.symbols());
    }

    public Optional<Map<String, String>> getLastKnownSymbols() {
        return Optional.ofNullable(symbols.get()).map(CachedSymbols::symbols);
    }

    public void putSymbols(Map<String, String> codes) {
        symbols.set(new CachedSymbols(Collections.unmodifiableMap(new LinkedHashMap<>(codes)), clock.instant()));
    }

    public void clear() {
        rates.clear();
        symbols.set(null);
    }

    public int size() {
        return rates.size();
    }

    private boolean isFresh(Instant since, Duration ttl) {
        return clock.instant().isBefore(since.plus(ttl));
    }

    private record CachedSymbols(Map<String, String> symbols, Instant cachedAt) {
    }
}
