package com.flagship.fx_payments.exception;

import com.flagship.fx_payments.approval.ApprovalAction;
import lombok.Getter;

import java.util.UUID;

/**
 * The creator of a payment tried to approve or reject it.
 */
@Getter
public class SelfApprovalForbiddenException extends StateTransitionException {

    private final UUID paymentId;
    private final String actorId;

    public SelfApprovalForbiddenException(UUID paymentId, String actorId, ApprovalAction action) {
        super("SELF_APPROVAL_FORBIDDEN",
            String.format("Actor %s created payment %s and cannot %s it", actorId, paymentId, action));
        this.paymentId = paymentId;
        this.actorId = actorId;
    }
}
