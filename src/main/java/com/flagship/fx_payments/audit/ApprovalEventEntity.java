package com.flagship.fx_payments.audit;

import com.flagship.fx_payments.approval.ApprovalAction;
import com.flagship.fx_payments.payment.PaymentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Row in the append-only approval history. Every column is insert-only.
 */
@Entity
@Table(
    name = "approval_events",
    indexes = {
        @Index(name = "idx_approval_events_payment", columnList = "payment_id, sequence_number")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApprovalEventEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payment_id", nullable = false, updatable = false)
    private UUID paymentId;

    @Column(name = "actor_id", nullable = false, updatable = false, length = 100)
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private ApprovalAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", nullable = false, updatable = false, length = 30)
    private PaymentStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, updatable = false, length = 30)
    private PaymentStatus toStatus;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String comment;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static ApprovalEventEntity fromDomain(ApprovalEvent event) {
        return new ApprovalEventEntity(
            event.getId(),
            event.getPaymentId(),
            event.getActorId(),
            event.getAction(),
            event.getFromStatus(),
            event.getToStatus(),
            event.getComment(),
            event.getTimestamp(),
            null
        );
    }

    public ApprovalEvent toDomain() {
        return new ApprovalEvent(id, paymentId, actorId, action, fromStatus, toStatus, comment, occurredAt);
    }
}
