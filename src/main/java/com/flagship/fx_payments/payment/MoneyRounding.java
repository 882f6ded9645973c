package com.flagship.fx_payments.payment;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;

/**
 * Rounds amounts to a currency's minor unit, HALF_EVEN.
 *
 * Calculations keep full precision; this is applied once, when a payment is stored
 * or rendered.
 */
public final class MoneyRounding {

    private MoneyRounding() {
    }

    public static BigDecimal round(BigDecimal amount, String currency) {
        return amount.setScale(fractionDigits(currency), RoundingMode.HALF_EVEN);
    }

    /**
     * Smallest representable amount, e.g. 0.01 for EUR, 1 for JPY.
     */
    public static BigDecimal minorUnit(String currency) {
        return BigDecimal.ONE.movePointLeft(fractionDigits(currency));
    }

    static int fractionDigits(String currency) {
        int digits = Currency.getInstance(currency).getDefaultFractionDigits();
        // Pseudo-currencies report -1.
        return digits < 0 ? 2 : digits;
    }
}
