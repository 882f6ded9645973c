package com.flagship.fx_payments.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class QuoteAlreadyUsedException extends FxPaymentsException {

    private final UUID quoteId;

    public QuoteAlreadyUsedException(UUID quoteId) {
        super("QUOTE_ALREADY_USED", "Quote " + quoteId + " has already been used by another payment");
        this.quoteId = quoteId;
    }
}
