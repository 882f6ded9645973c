package com.flagship.fx_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fx_payments.approval.ApprovalAction;
import com.flagship.fx_payments.audit.ApprovalEvent;
import com.flagship.fx_payments.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ApprovalEventResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("actor_id")
    String actorId;

    @JsonProperty("action")
    ApprovalAction action;

    @JsonProperty("from_status")
    PaymentStatus fromStatus;

    @JsonProperty("to_status")
    PaymentStatus toStatus;

    @JsonProperty("comment")
    String comment;

    @JsonProperty("timestamp")
    Instant timestamp;

    public static ApprovalEventResponse from(ApprovalEvent event) {
        return ApprovalEventResponse.builder()
            .id(event.getId())
            .paymentId(event.getPaymentId())
            .actorId(event.getActorId())
            .action(event.getAction())
            .fromStatus(event.getFromStatus())
            .toStatus(event.getToStatus())
            .comment(event.getComment())
            .timestamp(event.getTimestamp())
            .build();
    }
}
