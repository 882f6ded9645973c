package com.flagship.fx_payments.payment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of events about a payment. {@code eventId} is what consumers deduplicate on.
 */
public interface PaymentEvent {

    UUID getEventId();

    UUID getPaymentId();

    Instant getOccurredAt();

    String getEventType();
}
