package com.flagship.fx_payments.audit;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * General audit record for actions outside the approval history, such as quote issue
 * and draft creation. {@code details} is a JSON document.
 */
@Value
public class AuditLogEntry {
    UUID id;
    String actorId;
    String entityType;
    UUID entityId;
    String action;
    String details;
    Instant createdAt;
}
