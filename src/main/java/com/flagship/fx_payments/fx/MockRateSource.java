package com.flagship.fx_payments.fx;

import com.flagship.fx_payments.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Collections;
import java.util.Currency;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Synthetic rate source used when no provider key is configured, and as the
 * last-resort fallback when the live provider is down and nothing is cached.
 *
 * Rates come from a fixed GBP-based table with a uniform jitter of at most
 * +/-0.5% applied per fetch. The set of codes in the table is the set of
 * currencies the service can quote.
 */
@Slf4j
public class MockRateSource implements RateSource {

    static final BigDecimal MAX_JITTER = new BigDecimal("0.005");

    private static final int RATE_SCALE = 8;
    // Jitter is drawn in millionths so no floating point reaches the rate.
    private static final int JITTER_MILLIONTHS = 5000;

    private static final Map<String, BigDecimal> GBP_BASE_RATES;

    static {
        Map<String, BigDecimal> rates = new LinkedHashMap<>();
        rates.put("GBP", new BigDecimal("1.0000"));
        rates.put("EUR", new BigDecimal("1.1650"));
        rates.put("USD", new BigDecimal("1.2720"));
        rates.put("CHF", new BigDecimal("1.1250"));
        rates.put("JPY", new BigDecimal("145.50"));
        rates.put("CAD", new BigDecimal("1.6850"));
        rates.put("AUD", new BigDecimal("1.8450"));
        rates.put("NZD", new BigDecimal("1.9750"));
        rates.put("SEK", new BigDecimal("13.25"));
        rates.put("NOK", new BigDecimal("13.15"));
        rates.put("DKK", new BigDecimal("8.68"));
        rates.put("PLN", new BigDecimal("5.05"));
        rates.put("CZK", new BigDecimal("28.50"));
        GBP_BASE_RATES = Collections.unmodifiableMap(rates);
    }

    private final Clock clock;
    private final Random random;

    public MockRateSource(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    @Override
    public Rate fetch(CurrencyPair pair) {
        BigDecimal midRate = baseRate(pair).multiply(BigDecimal.ONE.add(nextJitter()))
            .setScale(RATE_SCALE, RoundingMode.HALF_EVEN);
        log.debug("Mock rate for {}: {}", pair, midRate);
        return new Rate(pair, midRate, clock.instant(), RateSourceType.MOCK);
    }

    @Override
    public Map<String, String> fetchSymbols() {
        Map<String, String> symbols = new LinkedHashMap<>();
        for (String code : GBP_BASE_RATES.keySet()) {
            symbols.put(code, Currency.getInstance(code).getDisplayName(Locale.ENGLISH));
        }
        return symbols;
    }

    @Override
    public RateSourceType type() {
        return RateSourceType.MOCK;
    }

    public boolean supports(String currency) {
        return GBP_BASE_RATES.containsKey(currency);
    }

    public Set<String> supportedCurrencies() {
        return GBP_BASE_RATES.keySet();
    }

    /**
     * Jitter-free table rate for the pair.
     *
     * @throws ValidationException if either code is outside the table
     */
    public BigDecimal baseRate(CurrencyPair pair) {
        BigDecimal perGbpSource = tableRate(pair.getSource());
        BigDecimal perGbpTarget = tableRate(pair.getTarget());
        return perGbpTarget.divide(perGbpSource, MathContext.DECIMAL128);
    }

    private BigDecimal tableRate(String currency) {
        BigDecimal rate = GBP_BASE_RATES.get(currency);
        if (rate == null) {
            throw new ValidationException("Unsupported currency: " + currency);
        }
        return rate;
    }

    private BigDecimal nextJitter() {
        int millionths = random.nextInt(2 * JITTER_MILLIONTHS + 1) - JITTER_MILLIONTHS;
        return BigDecimal.valueOf(millionths, 6);
    }
}
