package com.flagship.fx_payments.exception;

/**
 * The store rejected or failed a write. Details stay in the logs, never in the response.
 */
public class PersistenceException extends FxPaymentsException {

    public PersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_ERROR", message, cause);
    }
}
