package com.flagship.fx_payments.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Fee schedule bound from {@code payments.fee.*}. Amounts are in the payment's source currency.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "payments.fee")
public class FeeProperties {

    @NotNull
    @DecimalMin(value = "0.0")
    private BigDecimal percentage = new BigDecimal("0.001");

    @NotNull
    @DecimalMin(value = "0.0")
    private BigDecimal minimum = BigDecimal.ZERO;
}
