package com.flagship.fx_payments.payment;

/**
 * Which side of the conversion the requested amount fixes.
 * SEND fixes the source amount, RECEIVE fixes the target amount.
 */
public enum PaymentDirection {
    SEND,
    RECEIVE
}
