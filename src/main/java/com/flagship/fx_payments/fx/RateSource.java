package com.flagship.fx_payments.fx;

import java.util.Map;

/**
 * A provider of mid-market rates.
 *
 * Implementations fail only with {@link RateSourceException}; the quote engine
 * turns those failures into degraded quotes instead of errors.
 */
public interface RateSource {

    /**
     * @throws RateSourceException if the rate cannot be obtained
     */
    Rate fetch(CurrencyPair pair);

    /**
     * Currency codes the source can quote, mapped to display names.
     *
     * @throws RateSourceException if the list cannot be obtained
     */
    Map<String, String> fetchSymbols();

    RateSourceType type();
}
