package com.flagship.fx_payments.payment;

import java.math.BigDecimal;

/**
 * Fee charged on top of a payment, in the source currency. Must be pure and non-negative.
 */
@FunctionalInterface
public interface FeePolicy {

    BigDecimal feeFor(BigDecimal sourceAmount, String sourceCurrency);
}
