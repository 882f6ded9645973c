package com.flagship.fx_payments.fx;

import lombok.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A time-bounded, markup-adjusted rate offer.
 *
 * Quotes are never mutated after issue; they only age. A quote is usable while
 * {@code now < expiresAt}. Rates carry eight decimal places.
 */
@Value
public class Quote {

    public static final int RATE_SCALE = 8;

    UUID id;
    CurrencyPair pair;
    BigDecimal baseRate;
    BigDecimal markupPercentage;
    BigDecimal finalRate;
    Instant issuedAt;
    Instant expiresAt;
    boolean degraded;
    RateSourceType rateSource;
    Instant rateFetchedAt;

    /**
     * Issues a quote on top of a mid-market rate.
     *
     * @param markupPercentage decimal markup, e.g. {@code 0.005} for half a percent
     * @param degraded         true when the rate came from a stale cache entry or the synthetic fallback
     */
    public static Quote issue(Rate rate, BigDecimal markupPercentage, Instant issuedAt,
                              Duration validity, boolean degraded) {
        if (validity.isZero() || validity.isNegative()) {
            throw new IllegalArgumentException("Quote validity must be positive: " + validity);
        }
        BigDecimal baseRate = rate.getMidRate().setScale(RATE_SCALE, RoundingMode.HALF_EVEN);
        BigDecimal finalRate = rate.getMidRate()
            .multiply(BigDecimal.ONE.add(markupPercentage))
            .setScale(RATE_SCALE, RoundingMode.HALF_EVEN);
        if (finalRate.signum() <= 0) {
            throw new IllegalStateException("Final rate for " + rate.getPair() + " is not positive: " + finalRate);
        }
        return new Quote(
            UUID.randomUUID(),
            rate.getPair(),
            baseRate,
            markupPercentage,
            finalRate,
            issuedAt,
            issuedAt.plus(validity),
            degraded,
            rate.getSource(),
            rate.getFetchedAt()
        );
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Whole seconds left before expiry, never negative.
     */
    public long secondsRemaining(Instant now) {
        return Math.max(0, Duration.between(now, expiresAt).getSeconds());
    }

    /**
     * Units of source bought by one unit of target at the final rate.
     */
    public BigDecimal inverseRate() {
        return BigDecimal.ONE.divide(finalRate, MathContext.DECIMAL128)
            .setScale(RATE_SCALE, RoundingMode.HALF_EVEN);
    }

    /**
     * Portion of the final rate that is markup, in target units per source unit.
     */
    public BigDecimal markupAmount() {
        return finalRate.subtract(baseRate);
    }
}
