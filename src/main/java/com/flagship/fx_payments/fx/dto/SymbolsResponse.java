package com.flagship.fx_payments.fx.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response of the provider's {@code /symbols} endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class SymbolsResponse {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("symbols")
    private Map<String, String> symbols;

    @JsonProperty("error")
    private ProviderError error;
}
