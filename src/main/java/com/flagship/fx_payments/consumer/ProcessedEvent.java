package com.flagship.fx_payments.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Marker that a consumer group has dealt with an event, so a redelivered copy
 * is acknowledged without touching the payment again.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    UUID paymentId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String detail;

    public enum ProcessingResult {
        APPLIED,    // outcome moved the payment
        SKIPPED     // outcome was unusable or not allowed in the payment's current state
    }

    public static ProcessedEvent applied(UUID eventId, String eventType, UUID paymentId,
                                         String consumerGroup, Instant processedAt) {
        return new ProcessedEvent(eventId, eventType, paymentId, consumerGroup,
            processedAt, ProcessingResult.APPLIED, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, UUID paymentId,
                                         String consumerGroup, Instant processedAt, String reason) {
        return new ProcessedEvent(eventId, eventType, paymentId, consumerGroup,
            processedAt, ProcessingResult.SKIPPED, reason);
    }
}
