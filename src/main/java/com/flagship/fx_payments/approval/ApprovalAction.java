package com.flagship.fx_payments.approval;

/**
 * Actions recorded against a payment. The first three are taken by people; the
 * EXECUTION_* actions are reported by the execution provider and recorded as {@code system}.
 */
public enum ApprovalAction {
    SUBMIT,
    APPROVE,
    REJECT,
    EXECUTION_SUBMITTED,
    EXECUTION_PROCESSING,
    EXECUTION_COMPLETED,
    EXECUTION_FAILED;

    /**
     * Decisions that the payment's creator may never take.
     */
    public boolean isCheckerDecision() {
        return this == APPROVE || this == REJECT;
    }
}
