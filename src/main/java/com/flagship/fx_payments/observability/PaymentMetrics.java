package com.flagship.fx_payments.observability;

import com.flagship.fx_payments.approval.ApprovalAction;
import com.flagship.fx_payments.payment.PaymentStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for payment drafts and the approval workflow.
 *
 * Metrics exposed:
 * - payments.drafts.created: drafts built from a quote, tagged by source currency and direction
 * - payments.transitions: accepted transitions, tagged by action and resulting status
 * - payments.transitions.rejected: refused actions, tagged by action and reason
 * - payments.latency: operation latency
 * - event.processed / event.processing.failure: execution outcome consumption
 */
@Component
public class PaymentMetrics {

    private final MeterRegistry registry;
    private final Counter selfApprovalAttempts;

    public PaymentMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.selfApprovalAttempts = Counter.builder("payments.self_approval.attempts")
                .description("Attempts by a payment's creator to approve or reject it")
                .register(registry);
    }

    public void recordDraftCreated(String sourceCurrency, String direction, String status) {
        registry.counter("payments.drafts.created",
                "currency", sanitizeTag(sourceCurrency),
                "direction", sanitizeTag(direction),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordTransition(ApprovalAction action, PaymentStatus to) {
        registry.counter("payments.transitions",
                "action", action.name(),
                "to", to.name()
        ).increment();
    }

    public void recordTransitionRejected(ApprovalAction action, String reason) {
        registry.counter("payments.transitions.rejected",
                "action", action.name(),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordSelfApprovalAttempt() {
        selfApprovalAttempts.increment();
    }

    public void recordPaymentLatency(String operation, long durationMs) {
        registry.timer("payments.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordEventProcessed(String eventType, boolean wasNew) {
        Counter.builder("event.processed")
                .tag("event_type", eventType)
                .tag("was_new", String.valueOf(wasNew))
                .register(registry)
                .increment();
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        Counter.builder("event.processing.failure")
                .tag("event_type", eventType)
                .tag("error", sanitizeTag(error))
                .register(registry)
                .increment();
    }

    /**
     * Sanitizes a tag value to keep cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
