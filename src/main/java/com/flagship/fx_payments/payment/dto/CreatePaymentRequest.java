package com.flagship.fx_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fx_payments.payment.PaymentDirection;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CreatePaymentRequest {

    @NotNull(message = "Quote ID is required")
    @JsonProperty("quote_id")
    UUID quoteId;

    @NotNull(message = "Direction is required")
    @JsonProperty("direction")
    PaymentDirection direction;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 140, message = "Reference must be at most 140 characters")
    @JsonProperty("reference")
    String reference;
}
