package com.flagship.fx_payments.audit;

import com.flagship.fx_payments.approval.ApprovalAction;
import com.flagship.fx_payments.payment.PaymentStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One accepted status transition of a payment. Written once, never changed.
 */
@Value
public class ApprovalEvent {
    UUID id;
    UUID paymentId;
    String actorId;
    ApprovalAction action;
    PaymentStatus fromStatus;
    PaymentStatus toStatus;
    String comment;
    Instant timestamp;

    public static ApprovalEvent record(UUID paymentId, String actorId, ApprovalAction action,
                                       PaymentStatus fromStatus, PaymentStatus toStatus,
                                       String comment, Instant timestamp) {
        return new ApprovalEvent(UUID.randomUUID(), paymentId, actorId, action,
            fromStatus, toStatus, comment, timestamp);
    }
}
