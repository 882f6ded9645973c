package com.flagship.fx_payments.approval;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Status values reported by the execution provider.
 */
public enum ExecutionOutcome {
    SUBMITTED(ApprovalAction.EXECUTION_SUBMITTED),
    PROCESSING(ApprovalAction.EXECUTION_PROCESSING),
    COMPLETED(ApprovalAction.EXECUTION_COMPLETED),
    FAILED(ApprovalAction.EXECUTION_FAILED);

    private final ApprovalAction action;

    ExecutionOutcome(ApprovalAction action) {
        this.action = action;
    }

    public ApprovalAction toAction() {
        return action;
    }

    @JsonCreator
    public static ExecutionOutcome fromValue(String value) {
        if (value == null) {
            return null;
        }
        return ExecutionOutcome.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
