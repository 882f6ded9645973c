package com.flagship.fx_payments.payment;

import com.flagship.fx_payments.exception.QuoteExpiredException;
import com.flagship.fx_payments.exception.ValidationException;
import com.flagship.fx_payments.fx.Quote;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Turns a quote and a requested amount into a DRAFT payment.
 *
 * <ul>
 *   <li>SEND: source = amount, target = amount x final rate</li>
 *   <li>RECEIVE: target = amount, source = amount / final rate</li>
 * </ul>
 * The fee is computed on the source amount and charged on top, so
 * total debit = source + fee, all in the source currency. Nothing is rounded here.
 */
@Component
@RequiredArgsConstructor
public class PaymentBuilder {

    private final Clock clock;

    public Payment build(Quote quote, PaymentDirection direction, BigDecimal amount,
                         FeePolicy feePolicy, String createdBy) {
        return build(quote, direction, amount, feePolicy, createdBy, null);
    }

    /**
     * @throws QuoteExpiredException if the quote's expiry is not after now
     * @throws ValidationException   if the amount is not positive or the creator is missing
     */
    public Payment build(Quote quote, PaymentDirection direction, BigDecimal amount,
                         FeePolicy feePolicy, String createdBy, String reference) {
        Instant now = clock.instant();
        if (quote.isExpiredAt(now)) {
            throw new QuoteExpiredException(quote.getId(), quote.getExpiresAt());
        }
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Amount must be positive");
        }
        if (direction == null) {
            throw new ValidationException("Direction is required");
        }
        if (createdBy == null || createdBy.isBlank()) {
            throw new ValidationException("Creator is required");
        }

        BigDecimal rate = quote.getFinalRate();
        BigDecimal sourceAmount;
        BigDecimal targetAmount;
        if (direction == PaymentDirection.SEND) {
            sourceAmount = amount;
            targetAmount = amount.multiply(rate);
        } else {
            targetAmount = amount;
            sourceAmount = amount.divide(rate, MathContext.DECIMAL128);
        }

        String sourceCurrency = quote.getPair().getSource();
        BigDecimal fee = feePolicy.feeFor(sourceAmount, sourceCurrency);
        if (fee == null || fee.signum() < 0) {
            throw new IllegalStateException("Fee policy returned an invalid fee: " + fee);
        }

        return new Payment(
            UUID.randomUUID(),
            quote.getId(),
            sourceCurrency,
            quote.getPair().getTarget(),
            direction,
            sourceAmount,
            targetAmount,
            rate,
            fee,
            sourceAmount.add(fee),
            PaymentStatus.DRAFT,
            createdBy,
            reference,
            null,
            null,
            now,
            now
        );
    }
}
