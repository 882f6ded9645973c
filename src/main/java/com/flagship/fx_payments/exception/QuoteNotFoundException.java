package com.flagship.fx_payments.exception;

import java.util.UUID;

public class QuoteNotFoundException extends FxPaymentsException {

    public QuoteNotFoundException(UUID quoteId) {
        super("QUOTE_NOT_FOUND", "Quote not found: " + quoteId);
    }
}
