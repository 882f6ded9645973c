package com.flagship.fx_payments.approval;

import com.flagship.fx_payments.payment.PaymentStatus;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The complete set of legal payment transitions.
 *
 * <pre>
 * DRAFT            --SUBMIT--------------&gt; PENDING_APPROVAL  (creator)
 * PENDING_APPROVAL --APPROVE-------------&gt; APPROVED          (not creator)
 * PENDING_APPROVAL --REJECT--------------&gt; REJECTED          (not creator)
 * APPROVED         --EXECUTION_SUBMITTED-&gt; SUBMITTED         (system)
 * SUBMITTED        --EXECUTION_PROCESSING&gt; PROCESSING        (system)
 * PROCESSING       --EXECUTION_COMPLETED-&gt; COMPLETED         (system)
 * PROCESSING       --EXECUTION_FAILED----&gt; FAILED            (system)
 * </pre>
 * Anything not listed is refused.
 *
 * The provider reports only submitted, completed and failed, so a terminal outcome can
 * arrive for a SUBMITTED payment. {@link #impliedStep} names the step recorded before it.
 */
public final class TransitionTable {

    @Value
    public static class Transition {
        PaymentStatus target;
        ActorRule actorRule;
    }

    private static final Map<PaymentStatus, Map<ApprovalAction, Transition>> TABLE =
        new EnumMap<>(PaymentStatus.class);

    static {
        add(PaymentStatus.DRAFT, ApprovalAction.SUBMIT, PaymentStatus.PENDING_APPROVAL, ActorRule.CREATOR);
        add(PaymentStatus.PENDING_APPROVAL, ApprovalAction.APPROVE, PaymentStatus.APPROVED, ActorRule.NOT_CREATOR);
        add(PaymentStatus.PENDING_APPROVAL, ApprovalAction.REJECT, PaymentStatus.REJECTED, ActorRule.NOT_CREATOR);
        add(PaymentStatus.APPROVED, ApprovalAction.EXECUTION_SUBMITTED, PaymentStatus.SUBMITTED, ActorRule.SYSTEM);
        add(PaymentStatus.SUBMITTED, ApprovalAction.EXECUTION_PROCESSING, PaymentStatus.PROCESSING, ActorRule.SYSTEM);
        add(PaymentStatus.PROCESSING, ApprovalAction.EXECUTION_COMPLETED, PaymentStatus.COMPLETED, ActorRule.SYSTEM);
        add(PaymentStatus.PROCESSING, ApprovalAction.EXECUTION_FAILED, PaymentStatus.FAILED, ActorRule.SYSTEM);
    }

    private static final Map<PaymentStatus, Map<ApprovalAction, ApprovalAction>> IMPLIED =
        new EnumMap<>(PaymentStatus.class);

    static {
        Map<ApprovalAction, ApprovalAction> fromSubmitted = new EnumMap<>(ApprovalAction.class);
        fromSubmitted.put(ApprovalAction.EXECUTION_COMPLETED, ApprovalAction.EXECUTION_PROCESSING);
        fromSubmitted.put(ApprovalAction.EXECUTION_FAILED, ApprovalAction.EXECUTION_PROCESSING);
        IMPLIED.put(PaymentStatus.SUBMITTED, fromSubmitted);
    }

    private TransitionTable() {
    }

    public static Optional<Transition> lookup(PaymentStatus from, ApprovalAction action) {
        Map<ApprovalAction, Transition> row = TABLE.get(from);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(action));
    }

    /**
     * The step to record before {@code action} when the payment is in {@code from}, if any.
     * The implied step itself still goes through {@link #lookup}.
     */
    public static Optional<ApprovalAction> impliedStep(PaymentStatus from, ApprovalAction action) {
        Map<ApprovalAction, ApprovalAction> row = IMPLIED.get(from);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(action));
    }

    public static Set<ApprovalAction> allowedActions(PaymentStatus from) {
        Map<ApprovalAction, Transition> row = TABLE.get(from);
        return row == null ? Collections.emptySet() : Collections.unmodifiableSet(row.keySet());
    }

    private static void add(PaymentStatus from, ApprovalAction action, PaymentStatus to, ActorRule rule) {
        TABLE.computeIfAbsent(from, status -> new EnumMap<>(ApprovalAction.class))
            .put(action, new Transition(to, rule));
    }
}
