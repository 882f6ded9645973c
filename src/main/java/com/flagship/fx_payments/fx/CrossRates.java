package com.flagship.fx_payments.fx;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Derives cross rates from rates quoted against a single pivot currency.
 *
 * Given pivot P and rates P->A and P->B, the cross rate is
 * {@code rate(A,B) = rate(P,B) / rate(P,A)}, with {@code rate(P,P) = 1}.
 */
public final class CrossRates {

    private CrossRates() {
    }

    public static BigDecimal triangulate(BigDecimal pivotToSource, BigDecimal pivotToTarget) {
        if (pivotToSource.signum() <= 0 || pivotToTarget.signum() <= 0) {
            throw new IllegalArgumentException("Pivot rates must be positive");
        }
        return pivotToTarget.divide(pivotToSource, MathContext.DECIMAL128);
    }
}
