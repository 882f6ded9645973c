package com.flagship.fx_payments.fx.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateQuoteRequest {

    @NotBlank(message = "Source currency is required")
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Source currency must be a 3-letter ISO code")
    @JsonProperty("source_currency")
    String sourceCurrency;

    @NotBlank(message = "Target currency is required")
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Target currency must be a 3-letter ISO code")
    @JsonProperty("target_currency")
    String targetCurrency;

    @DecimalMin(value = "0.0", message = "Markup percentage cannot be negative")
    @JsonProperty("markup_percentage")
    BigDecimal markupPercentage;
}
