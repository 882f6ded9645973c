package com.flagship.fx_payments.approval;

import com.flagship.fx_payments.audit.AuditTrail;
import com.flagship.fx_payments.payment.Payment;

/**
 * Who may take an action on a payment.
 */
public enum ActorRule {
    CREATOR {
        @Override
        public boolean permits(Payment payment, String actorId) {
            return payment.isCreatedBy(actorId);
        }
    },
    NOT_CREATOR {
        @Override
        public boolean permits(Payment payment, String actorId) {
            return !payment.isCreatedBy(actorId) && !AuditTrail.SYSTEM_ACTOR.equals(actorId);
        }
    },
    SYSTEM {
        @Override
        public boolean permits(Payment payment, String actorId) {
            return AuditTrail.SYSTEM_ACTOR.equals(actorId);
        }
    };

    public abstract boolean permits(Payment payment, String actorId);
}
