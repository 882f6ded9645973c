package com.flagship.fx_payments.exception;

import lombok.Getter;

/**
 * Root of the named business failures surfaced by the API.
 *
 * Each subclass carries a stable machine-readable code that ends up in the
 * {@code code} field of the error body, so clients can branch without parsing messages.
 */
@Getter
public abstract class FxPaymentsException extends RuntimeException {

    private final String code;

    protected FxPaymentsException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected FxPaymentsException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
