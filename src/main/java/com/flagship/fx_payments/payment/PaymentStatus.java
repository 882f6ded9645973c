package com.flagship.fx_payments.payment;

/**
 * Payment lifecycle. Drafts go through maker-checker approval, then execution.
 *
 * Terminal states: REJECTED, COMPLETED, FAILED.
 */
public enum PaymentStatus {
    DRAFT,
    PENDING_APPROVAL,
    APPROVED,
    REJECTED,
    SUBMITTED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == REJECTED || this == COMPLETED || this == FAILED;
    }
}
