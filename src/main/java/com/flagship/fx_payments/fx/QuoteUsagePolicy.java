package com.flagship.fx_payments.fx;

/**
 * Whether a quote may back more than one payment.
 */
public enum QuoteUsagePolicy {
    REUSABLE,
    SINGLE_USE
}
