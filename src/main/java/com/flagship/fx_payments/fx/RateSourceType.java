package com.flagship.fx_payments.fx;

/**
 * Where a rate came from.
 */
public enum RateSourceType {
    MOCK,
    LIVE
}
