package com.flagship.fx_payments.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Payment domain object.
 *
 * Amounts are in their own currency: source amount, fee and total debit in the source
 * currency, target amount in the target currency. The status only changes through the
 * approval state machine, which produces a new instance via {@link #transitionTo}.
 */
@Value
public class Payment {
    UUID id;
    UUID quoteId;
    String sourceCurrency;
    String targetCurrency;
    PaymentDirection direction;
    BigDecimal sourceAmount;
    BigDecimal targetAmount;
    BigDecimal fxRate;
    BigDecimal feeAmount;
    BigDecimal totalDebit;
    PaymentStatus status;
    String createdBy;
    String reference;
    String externalReference;
    String failureReason;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Returns a copy in the target status. A null reference or reason keeps the current value.
     */
    public Payment transitionTo(PaymentStatus target, String externalReference,
                                String failureReason, Instant at) {
        return new Payment(
            this.id,
            this.quoteId,
            this.sourceCurrency,
            this.targetCurrency,
            this.direction,
            this.sourceAmount,
            this.targetAmount,
            this.fxRate,
            this.feeAmount,
            this.totalDebit,
            target,
            this.createdBy,
            this.reference,
            externalReference != null ? externalReference : this.externalReference,
            failureReason != null ? failureReason : this.failureReason,
            this.createdAt,
            at
        );
    }

    public boolean isCreatedBy(String actorId) {
        return createdBy.equals(actorId);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
