package com.flagship.fx_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fx_payments.payment.MoneyRounding;
import com.flagship.fx_payments.payment.Payment;
import com.flagship.fx_payments.payment.PaymentDirection;
import com.flagship.fx_payments.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Amounts are rounded to the minor unit of their currency.
 */
@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("quote_id")
    UUID quoteId;

    @JsonProperty("direction")
    PaymentDirection direction;

    @JsonProperty("source_currency")
    String sourceCurrency;

    @JsonProperty("target_currency")
    String targetCurrency;

    @JsonProperty("source_amount")
    BigDecimal sourceAmount;

    @JsonProperty("target_amount")
    BigDecimal targetAmount;

    @JsonProperty("fx_rate")
    BigDecimal fxRate;

    @JsonProperty("fee_amount")
    BigDecimal feeAmount;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("external_reference")
    String externalReference;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PaymentResponse from(Payment payment) {
        String source = payment.getSourceCurrency();
        return PaymentResponse.builder()
            .id(payment.getId())
            .quoteId(payment.getQuoteId())
            .direction(payment.getDirection())
            .sourceCurrency(source)
            .targetCurrency(payment.getTargetCurrency())
            .sourceAmount(MoneyRounding.round(payment.getSourceAmount(), source))
            .targetAmount(MoneyRounding.round(payment.getTargetAmount(), payment.getTargetCurrency()))
            .fxRate(payment.getFxRate())
            .feeAmount(MoneyRounding.round(payment.getFeeAmount(), source))
            .totalDebit(MoneyRounding.round(payment.getTotalDebit(), source))
            .status(payment.getStatus())
            .createdBy(payment.getCreatedBy())
            .reference(payment.getReference())
            .externalReference(payment.getExternalReference())
            .failureReason(payment.getFailureReason())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}
