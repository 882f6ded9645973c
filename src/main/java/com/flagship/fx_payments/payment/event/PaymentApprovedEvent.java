package com.flagship.fx_payments.payment.event;

import com.flagship.fx_payments.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Instruction handed to the execution provider once a checker approves a payment.
 * Written to the outbox in the approving transaction.
 */
@Value
public class PaymentApprovedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID quoteId;
    String sourceCurrency;
    String targetCurrency;
    BigDecimal sourceAmount;
    BigDecimal targetAmount;
    BigDecimal fxRate;
    BigDecimal feeAmount;
    BigDecimal totalDebit;
    String createdBy;
    String approvedBy;
    String reference;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentApproved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentApprovedEvent fromPayment(Payment payment, String approvedBy, Instant occurredAt) {
        return new PaymentApprovedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getQuoteId(),
            payment.getSourceCurrency(),
            payment.getTargetCurrency(),
            payment.getSourceAmount(),
            payment.getTargetAmount(),
            payment.getFxRate(),
            payment.getFeeAmount(),
            payment.getTotalDebit(),
            payment.getCreatedBy(),
            approvedBy,
            payment.getReference(),
            occurredAt
        );
    }
}
