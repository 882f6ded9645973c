package com.flagship.fx_payments.exception;

/**
 * Bad input: unknown or identical currencies, non-positive amounts, unusable markup.
 */
public class ValidationException extends FxPaymentsException {

    public ValidationException(String message) {
        super("VALIDATION_FAILED", message);
    }
}
