package com.flagship.fx_payments.exception;

import java.util.UUID;

public class PaymentNotFoundException extends FxPaymentsException {

    public PaymentNotFoundException(UUID paymentId) {
        super("PAYMENT_NOT_FOUND", "Payment not found: " + paymentId);
    }
}
