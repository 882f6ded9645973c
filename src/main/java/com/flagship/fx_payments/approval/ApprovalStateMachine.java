package com.flagship.fx_payments.approval;

import com.flagship.fx_payments.audit.ApprovalEvent;
import com.flagship.fx_payments.audit.AuditTrail;
import com.flagship.fx_payments.exception.InvalidTransitionException;
import com.flagship.fx_payments.exception.PaymentNotFoundException;
import com.flagship.fx_payments.exception.SelfApprovalForbiddenException;
import com.flagship.fx_payments.exception.ValidationException;
import com.flagship.fx_payments.observability.CorrelationContext;
import com.flagship.fx_payments.observability.PaymentMetrics;
import com.flagship.fx_payments.outbox.OutboxService;
import com.flagship.fx_payments.payment.Payment;
import com.flagship.fx_payments.payment.PaymentPersistenceService;
import com.flagship.fx_payments.payment.PaymentStatus;
import com.flagship.fx_payments.payment.event.PaymentApprovedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Moves payments through {@link TransitionTable} and enforces maker-checker.
 *
 * Each public operation runs as one transaction: the payment row is locked
 * (SELECT ... FOR UPDATE), the action is checked, the new status and one
 * {@link ApprovalEvent} are written, and for approvals the execution instruction is
 * added to the outbox. Any refusal throws before anything is written, so the payment
 * is left as it was. Transitions are never retried automatically.
 *
 * The provider may report completed or failed with no processing notice before it. For a
 * SUBMITTED payment that outcome is applied as two table steps in the same transaction,
 * SUBMITTED to PROCESSING and then the terminal one, each with its own event.
 *
 * Check order:
 * <ol>
 *   <li>creator approving or rejecting their own payment, in any state: SelfApprovalForbiddenException</li>
 *   <li>no table entry for (status, action): InvalidTransitionException</li>
 *   <li>actor not allowed by the entry's rule: InvalidTransitionException</li>
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalStateMachine {

    private static final String AGGREGATE_TYPE = "Payment";

    private final PaymentPersistenceService persistenceService;
    private final AuditTrail auditTrail;
    private final OutboxService outboxService;
    private final PaymentMetrics paymentMetrics;
    private final Clock clock;

    /**
     * Maker sends a draft for approval.
     */
    @Transactional
    public Payment submit(UUID paymentId, String actorId) {
        return submit(paymentId, actorId, null);
    }

    @Transactional
    public Payment submit(UUID paymentId, String actorId, String comment) {
        return transition(paymentId, ApprovalAction.SUBMIT, requireHumanActor(actorId), comment, null, null);
    }

    /**
     * Checker approves. Queues the payment for execution.
     */
    @Transactional
    public Payment approve(UUID paymentId, String actorId, String comment) {
        return transition(paymentId, ApprovalAction.APPROVE, requireHumanActor(actorId), comment, null, null);
    }

    /**
     * Checker rejects. REJECTED is terminal.
     */
    @Transactional
    public Payment reject(UUID paymentId, String actorId, String comment) {
        return transition(paymentId, ApprovalAction.REJECT, requireHumanActor(actorId), comment, null, null);
    }

    /**
     * Applies a status report from the execution provider, as the {@code system} actor.
     */
    @Transactional
    public Payment recordExecutionOutcome(UUID paymentId, ExecutionOutcome outcome,
                                          String externalReference, String failureReason) {
        if (outcome == null) {
            throw new ValidationException("Execution outcome is required");
        }
        return transition(paymentId, outcome.toAction(), AuditTrail.SYSTEM_ACTOR,
            null, externalReference, failureReason);
    }

    /**
     * Approval events of a payment, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ApprovalEvent> history(UUID paymentId) {
        if (persistenceService.findById(paymentId).isEmpty()) {
            throw new PaymentNotFoundException(paymentId);
        }
        return auditTrail.history(paymentId);
    }

    private Payment transition(UUID paymentId, ApprovalAction action, String actorId, String comment,
                               String externalReference, String failureReason) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId.toString());
        try {
            Payment current = persistenceService.lockForTransition(paymentId);

            if (action.isCheckerDecision() && current.isCreatedBy(actorId)) {
                paymentMetrics.recordSelfApprovalAttempt();
                paymentMetrics.recordTransitionRejected(action, "self_approval");
                log.warn("Refused {} by {}: actor created the payment", action, actorId);
                throw new SelfApprovalForbiddenException(paymentId, actorId, action);
            }

            PaymentStatus from = current.getStatus();
            Instant now = clock.instant();
            Optional<ApprovalAction> implied = TransitionTable.impliedStep(from, action);
            if (implied.isPresent()) {
                log.info("Provider reported {} for payment {} without a processing notice; recording {} first",
                    action, paymentId, implied.get());
                current = applyStep(current, implied.get(), actorId, null, externalReference, null, now);
            }
            Payment updated = applyStep(current, action, actorId, comment, externalReference, failureReason, now);

            long duration = System.currentTimeMillis() - startTime;
            paymentMetrics.recordPaymentLatency(action.name().toLowerCase(), duration);
            log.info("Payment {} -> {} by {} ({}), duration={}ms",
                from, updated.getStatus(), actorId, action, duration);

            return updated;
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    /**
     * One table transition on the locked payment: status write, its ApprovalEvent, and the
     * outbox instruction when the payment becomes APPROVED.
     */
    private Payment applyStep(Payment current, ApprovalAction action, String actorId, String comment,
                              String externalReference, String failureReason, Instant now) {
        UUID paymentId = current.getId();
        TransitionTable.Transition transition = TransitionTable.lookup(current.getStatus(), action)
            .orElseThrow(() -> {
                paymentMetrics.recordTransitionRejected(action, "invalid_transition");
                log.warn("Refused {} by {}: not allowed from {}", action, actorId, current.getStatus());
                return new InvalidTransitionException(paymentId, current.getStatus(), action);
            });

        if (!transition.getActorRule().permits(current, actorId)) {
            paymentMetrics.recordTransitionRejected(action, "actor_not_permitted");
            log.warn("Refused {} by {}: requires {} actor", action, actorId, transition.getActorRule());
            throw new InvalidTransitionException(paymentId, current.getStatus(), action,
                String.format("Actor %s may not %s payment %s; requires %s",
                    actorId, action, paymentId, transition.getActorRule()));
        }

        PaymentStatus from = current.getStatus();
        Payment updated = persistenceService.applyTransition(
            current.transitionTo(transition.getTarget(), externalReference, failureReason, now));

        auditTrail.append(ApprovalEvent.record(paymentId, actorId, action, from, updated.getStatus(), comment, now));

        if (updated.getStatus() == PaymentStatus.APPROVED) {
            PaymentApprovedEvent event = PaymentApprovedEvent.fromPayment(updated, actorId, now);
            outboxService.saveEvent(AGGREGATE_TYPE, paymentId, PaymentApprovedEvent.EVENT_TYPE, event);
        }

        paymentMetrics.recordTransition(action, updated.getStatus());
        return updated;
    }

    private static String requireHumanActor(String actorId) {
        if (actorId == null || actorId.isBlank()) {
            throw new ValidationException("Actor id is required");
        }
        if (AuditTrail.SYSTEM_ACTOR.equals(actorId)) {
            throw new ValidationException("Actor id '" + AuditTrail.SYSTEM_ACTOR + "' is reserved");
        }
        return actorId;
    }
}
