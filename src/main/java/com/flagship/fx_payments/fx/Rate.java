package com.flagship.fx_payments.fx;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Mid-market rate for a pair: one unit of source buys {@code midRate} units of target.
 */
@Value
public class Rate {
    CurrencyPair pair;
    BigDecimal midRate;
    Instant fetchedAt;
    RateSourceType source;
}
