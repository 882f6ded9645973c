package com.flagship.fx_payments.exception;

import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

@Getter
public class QuoteExpiredException extends FxPaymentsException {

    private final UUID quoteId;
    private final Instant expiredAt;

    public QuoteExpiredException(UUID quoteId, Instant expiredAt) {
        super("QUOTE_EXPIRED", "Quote " + quoteId + " expired at " + expiredAt + "; request a new quote");
        this.quoteId = quoteId;
        this.expiredAt = expiredAt;
    }
}
