package com.flagship.fx_payments.exception;

/**
 * A payment action that the approval workflow refused. The payment is left untouched.
 */
public abstract class StateTransitionException extends FxPaymentsException {

    protected StateTransitionException(String code, String message) {
        super(code, message);
    }
}
