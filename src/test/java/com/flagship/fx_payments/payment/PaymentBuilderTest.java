package com.flagship.fx_payments.payment;

import com.flagship.fx_payments.config.FeeProperties;
import com.flagship.fx_payments.exception.QuoteExpiredException;
import com.flagship.fx_payments.exception.ValidationException;
import com.flagship.fx_payments.fx.CurrencyPair;
import com.flagship.fx_payments.fx.Quote;
import com.flagship.fx_payments.fx.Rate;
import com.flagship.fx_payments.fx.RateSourceType;
import com.flagship.fx_payments.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PaymentBuilderTest {

    private static final FeePolicy FLAT_FIVE = (amount, currency) -> new BigDecimal("5.00");
    private static final FeePolicy NO_FEE = (amount, currency) -> BigDecimal.ZERO;

    private MutableClock clock;
    private PaymentBuilder builder;
    private Quote gbpEur;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        builder = new PaymentBuilder(clock);
        Rate rate = new Rate(CurrencyPair.of("GBP", "EUR"), new BigDecimal("1.1600"), clock.instant(), RateSourceType.MOCK);
        gbpEur = Quote.issue(rate, new BigDecimal("0.005"), clock.instant(), Duration.ofSeconds(120), false);
    }

    @Test
    @DisplayName("Sending 1000.00 GBP at 1.1658 with a 5.00 fee")
    void testBuild_SendScenario() {
        Payment payment = builder.build(gbpEur, PaymentDirection.SEND, new BigDecimal("1000.00"), FLAT_FIVE, "user42");

        assertEquals(PaymentStatus.DRAFT, payment.getStatus());
        assertEquals("GBP", payment.getSourceCurrency());
        assertEquals("EUR", payment.getTargetCurrency());
        assertEquals(new BigDecimal("1.16580000"), payment.getFxRate());
        assertEquals(new BigDecimal("1165.80"), MoneyRounding.round(payment.getTargetAmount(), "EUR"));
        assertEquals(new BigDecimal("1005.00"), MoneyRounding.round(payment.getTotalDebit(), "GBP"));
        assertEquals(0, new BigDecimal("5.00").compareTo(payment.getFeeAmount()));
        assertEquals(gbpEur.getId(), payment.getQuoteId());
        assertEquals("user42", payment.getCreatedBy());
        assertEquals(clock.instant(), payment.getCreatedAt());
    }

    @Test
    @DisplayName("Receiving fixes the target and derives the source")
    void testBuild_ReceiveDerivesSource() {
        Payment payment = builder.build(gbpEur, PaymentDirection.RECEIVE, new BigDecimal("1165.80"), NO_FEE, "user42");

        assertEquals(0, new BigDecimal("1165.80").compareTo(payment.getTargetAmount()));
        assertEquals(new BigDecimal("1000.00"), MoneyRounding.round(payment.getSourceAmount(), "GBP"));
    }

    @Test
    @DisplayName("SEND then RECEIVE of the result returns the original amount within one minor unit")
    void testBuild_RoundTrip() {
        for (String amount : new String[]{"0.01", "1.00", "999.99", "12345.67", "1000000.00"}) {
            BigDecimal original = new BigDecimal(amount);
            Payment send = builder.build(gbpEur, PaymentDirection.SEND, original, NO_FEE, "user42");
            BigDecimal received = MoneyRounding.round(send.getTargetAmount(), "EUR");

            Payment receive = builder.build(gbpEur, PaymentDirection.RECEIVE, received, NO_FEE, "user42");
            BigDecimal back = MoneyRounding.round(receive.getSourceAmount(), "GBP");

            assertTrue(back.subtract(original).abs().compareTo(MoneyRounding.minorUnit("GBP")) <= 0,
                amount + " came back as " + back);
        }
    }

    @Test
    @DisplayName("Fee from the percentage policy is charged on top of the source amount")
    void testBuild_PercentageFee() {
        FeeProperties feeProperties = new FeeProperties();
        feeProperties.setPercentage(new BigDecimal("0.001"));
        feeProperties.setMinimum(new BigDecimal("2.00"));
        PercentageFeePolicy policy = new PercentageFeePolicy(feeProperties);

        Payment large = builder.build(gbpEur, PaymentDirection.SEND, new BigDecimal("10000.00"), policy, "user42");
        Payment small = builder.build(gbpEur, PaymentDirection.SEND, new BigDecimal("100.00"), policy, "user42");

        assertEquals(0, new BigDecimal("10.00").compareTo(large.getFeeAmount()));
        assertEquals(0, new BigDecimal("10010.00").compareTo(large.getTotalDebit()));
        assertEquals(0, new BigDecimal("2.00").compareTo(small.getFeeAmount()));
    }

    @Test
    @DisplayName("A quote is refused from the instant it expires")
    void testBuild_ExpiredQuote() {
        clock.set(gbpEur.getExpiresAt().minusMillis(1));
        assertNotNull(builder.build(gbpEur, PaymentDirection.SEND, BigDecimal.TEN, NO_FEE, "user42"));

        clock.set(gbpEur.getExpiresAt());
        QuoteExpiredException e = assertThrows(QuoteExpiredException.class,
            () -> builder.build(gbpEur, PaymentDirection.SEND, BigDecimal.TEN, NO_FEE, "user42"));
        assertEquals("QUOTE_EXPIRED", e.getCode());
    }

    @Test
    @DisplayName("Non-positive amounts and missing fields are rejected")
    void testBuild_InvalidInput() {
        assertThrows(ValidationException.class,
            () -> builder.build(gbpEur, PaymentDirection.SEND, BigDecimal.ZERO, NO_FEE, "user42"));
        assertThrows(ValidationException.class,
            () -> builder.build(gbpEur, PaymentDirection.SEND, new BigDecimal("-1"), NO_FEE, "user42"));
        assertThrows(ValidationException.class,
            () -> builder.build(gbpEur, PaymentDirection.SEND, null, NO_FEE, "user42"));
        assertThrows(ValidationException.class,
            () -> builder.build(gbpEur, null, BigDecimal.TEN, NO_FEE, "user42"));
        assertThrows(ValidationException.class,
            () -> builder.build(gbpEur, PaymentDirection.SEND, BigDecimal.TEN, NO_FEE, " "));
    }
}
