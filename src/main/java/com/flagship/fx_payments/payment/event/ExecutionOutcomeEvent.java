package com.flagship.fx_payments.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.fx_payments.approval.ExecutionOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Status report from the execution provider, consumed from {@code payment-execution-outcomes}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutionOutcomeEvent {

    public static final String EVENT_TYPE = "ExecutionOutcome";

    private UUID eventId;
    private UUID paymentId;
    private ExecutionOutcome outcome;
    private String externalReference;
    private String failureReason;
}
