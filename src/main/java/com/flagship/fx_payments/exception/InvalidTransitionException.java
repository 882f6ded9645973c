package com.flagship.fx_payments.exception;

import com.flagship.fx_payments.approval.ApprovalAction;
import com.flagship.fx_payments.payment.PaymentStatus;
import lombok.Getter;

import java.util.UUID;

@Getter
public class InvalidTransitionException extends StateTransitionException {

    private final UUID paymentId;
    private final PaymentStatus currentStatus;
    private final ApprovalAction action;

    public InvalidTransitionException(UUID paymentId, PaymentStatus currentStatus, ApprovalAction action) {
        this(paymentId, currentStatus, action,
            String.format("Cannot %s payment %s in %s status", action, paymentId, currentStatus));
    }

    public InvalidTransitionException(UUID paymentId, PaymentStatus currentStatus,
                                      ApprovalAction action, String message) {
        super("INVALID_TRANSITION", message);
        this.paymentId = paymentId;
        this.currentStatus = currentStatus;
        this.action = action;
    }
}
