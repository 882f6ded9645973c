package com.flagship.fx_payments.fx;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Display view of how a quote's final rate is made up.
 */
@Value
public class QuoteBreakdown {
    BigDecimal baseRate;
    BigDecimal markupPercent;
    BigDecimal markupAmount;
    BigDecimal finalRate;
    BigDecimal inverseRate;

    public static QuoteBreakdown of(Quote quote) {
        return new QuoteBreakdown(
            quote.getBaseRate(),
            quote.getMarkupPercentage().movePointRight(2).setScale(4, RoundingMode.HALF_EVEN),
            quote.markupAmount(),
            quote.getFinalRate(),
            quote.inverseRate()
        );
    }
}
