package com.flagship.fx_payments.config;

import com.flagship.fx_payments.fx.QuoteUsagePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Settings for rate sources, quoting and the rate cache, bound from {@code fx.*}.
 *
 * An empty {@code fx.provider.api-key} selects the mock source. Durations accept
 * the usual Spring forms ({@code 120s}, {@code 30m}, {@code 24h}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "fx")
public class FxProperties {

    @NotNull
    @DecimalMin(value = "0.0")
    private BigDecimal markupPercentage = new BigDecimal("0.005");

    @Valid
    private Provider provider = new Provider();

    @Valid
    private Quote quote = new Quote();

    @Valid
    private Cache cache = new Cache();

    public boolean isLiveMode() {
        return provider.getApiKey() != null && !provider.getApiKey().isBlank();
    }

    @Data
    public static class Provider {
        private String apiKey = "";

        @NotBlank
        private String baseUrl = "http://data.fixer.io/api";

        @Pattern(regexp = "^[A-Z]{3}$")
        private String pivotCurrency = "EUR";

        private boolean sendBaseParameter = true;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(2);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(3);

        @Valid
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(200);

        private double multiplier = 2.0;

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(2);
    }

    @Data
    public static class Quote {
        @NotNull
        private Duration validity = Duration.ofSeconds(120);

        @NotNull
        private Duration fetchTimeout = Duration.ofSeconds(5);

        @Min(1)
        private int fetchThreads = 4;

        @NotNull
        private QuoteUsagePolicy usagePolicy = QuoteUsagePolicy.REUSABLE;

        @AssertTrue(message = "fx.quote.validity must be between 1s and 10m")
        public boolean isValidityInRange() {
            return validity != null
                && validity.compareTo(Duration.ofSeconds(1)) >= 0
                && validity.compareTo(Duration.ofMinutes(10)) <= 0;
        }
    }

    @Data
    public static class Cache {
        @NotNull
        private Duration rateTtl = Duration.ofMinutes(30);

        @NotNull
        private Duration symbolTtl = Duration.ofHours(24);
    }
}
