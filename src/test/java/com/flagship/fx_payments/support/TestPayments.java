package com.flagship.fx_payments.support;

import com.flagship.fx_payments.fx.CurrencyPair;
import com.flagship.fx_payments.fx.Quote;
import com.flagship.fx_payments.fx.Rate;
import com.flagship.fx_payments.fx.RateSourceType;
import com.flagship.fx_payments.payment.Payment;
import com.flagship.fx_payments.payment.PaymentBuilder;
import com.flagship.fx_payments.payment.PaymentDirection;
import com.flagship.fx_payments.payment.PaymentStatus;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

/**
 * Payment fixtures for unit tests.
 */
public final class TestPayments {

    private TestPayments() {
    }

    public static Quote gbpEurQuote(Clock clock) {
        Rate rate = new Rate(CurrencyPair.of("GBP", "EUR"), new BigDecimal("1.1600"), clock.instant(), RateSourceType.MOCK);
        return Quote.issue(rate, new BigDecimal("0.005"), clock.instant(), Duration.ofSeconds(120), false);
    }

    public static Payment draft(Clock clock, String createdBy) {
        return new PaymentBuilder(clock).build(gbpEurQuote(clock), PaymentDirection.SEND,
            new BigDecimal("1000.00"), (amount, currency) -> new BigDecimal("5.00"), createdBy, "INV-1001");
    }

    public static Payment inStatus(Clock clock, String createdBy, PaymentStatus status) {
        return draft(clock, createdBy).transitionTo(status, null, null, clock.instant());
    }
}
