package com.flagship.fx_payments.fx.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fx_payments.fx.Quote;
import com.flagship.fx_payments.fx.QuoteBreakdown;
import com.flagship.fx_payments.fx.RateSourceType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class QuoteResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("source_currency")
    String sourceCurrency;

    @JsonProperty("target_currency")
    String targetCurrency;

    @JsonProperty("base_rate")
    BigDecimal baseRate;

    @JsonProperty("markup_percentage")
    BigDecimal markupPercentage;

    @JsonProperty("markup_percent")
    BigDecimal markupPercent;

    @JsonProperty("markup_amount")
    BigDecimal markupAmount;

    @JsonProperty("final_rate")
    BigDecimal finalRate;

    @JsonProperty("inverse_rate")
    BigDecimal inverseRate;

    @JsonProperty("issued_at")
    Instant issuedAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("seconds_remaining")
    long secondsRemaining;

    @JsonProperty("degraded")
    boolean degraded;

    @JsonProperty("rate_source")
    RateSourceType rateSource;

    public static QuoteResponse from(Quote quote, QuoteBreakdown breakdown, long secondsRemaining) {
        return QuoteResponse.builder()
            .id(quote.getId())
            .sourceCurrency(quote.getPair().getSource())
            .targetCurrency(quote.getPair().getTarget())
            .baseRate(breakdown.getBaseRate())
            .markupPercentage(quote.getMarkupPercentage())
            .markupPercent(breakdown.getMarkupPercent())
            .markupAmount(breakdown.getMarkupAmount())
            .finalRate(breakdown.getFinalRate())
            .inverseRate(breakdown.getInverseRate())
            .issuedAt(quote.getIssuedAt())
            .expiresAt(quote.getExpiresAt())
            .secondsRemaining(secondsRemaining)
            .degraded(quote.isDegraded())
            .rateSource(quote.getRateSource())
            .build();
    }
}
