package com.flagship.fx_payments.consumer;

import com.flagship.fx_payments.approval.ApprovalStateMachine;
import com.flagship.fx_payments.payment.Payment;
import com.flagship.fx_payments.payment.event.ExecutionOutcomeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies execution provider reports to payments. Called by
 * {@link ExecutionOutcomeConsumer} after the idempotency check passes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionOutcomeHandler {

    private final ApprovalStateMachine stateMachine;

    public Payment onExecutionOutcome(ExecutionOutcomeEvent event) {
        log.info("Handling execution outcome: paymentId={}, outcome={}, externalReference={}",
                event.getPaymentId(), event.getOutcome(), event.getExternalReference());

        return stateMachine.recordExecutionOutcome(
            event.getPaymentId(),
            event.getOutcome(),
            event.getExternalReference(),
            event.getFailureReason());
    }
}
