package com.flagship.fx_payments.fx;

import com.flagship.fx_payments.config.FxProperties;
import com.flagship.fx_payments.fx.RateSourceException.Failure;
import com.flagship.fx_payments.fx.dto.LatestRatesResponse;
import com.flagship.fx_payments.fx.dto.ProviderError;
import com.flagship.fx_payments.fx.dto.SymbolsResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Rate source backed by a fixer-style HTTP provider.
 *
 * The provider quotes everything against one pivot currency, so any pair not
 * involving the pivot is triangulated through {@link CrossRates}. Every call is
 * wrapped in the supplied {@link RetryTemplate}; only {@code NETWORK} and
 * {@code UNAVAILABLE} failures are retried, bad keys and exhausted quotas fail
 * on the first attempt.
 *
 * Error mapping:
 * <ul>
 *   <li>code 101, {@code invalid_access_key}, {@code missing_access_key}, HTTP 401/403: INVALID_KEY</li>
 *   <li>code 104, {@code usage_limit_reached}, {@code rate_limit_reached}, HTTP 429: RATE_LIMITED</li>
 *   <li>I/O errors and timeouts: NETWORK</li>
 *   <li>anything else, including HTTP 5xx and a missing rate: UNAVAILABLE</li>
 * </ul>
 */
@Slf4j
public class LiveRateSource implements RateSource {

    private final RestClient restClient;
    private final FxProperties.Provider provider;
    private final RetryTemplate retryTemplate;
    private final Clock clock;

    public LiveRateSource(RestClient restClient, FxProperties.Provider provider,
                          RetryTemplate retryTemplate, Clock clock) {
        this.restClient = restClient;
        this.provider = provider;
        this.retryTemplate = retryTemplate;
        this.clock = clock;
    }

    @Override
    public Rate fetch(CurrencyPair pair) {
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.info("Retrying rate fetch for {} (attempt {})", pair, context.getRetryCount() + 1);
            }
            return fetchOnce(pair);
        });
    }

    @Override
    public Map<String, String> fetchSymbols() {
        return retryTemplate.execute(context -> {
            SymbolsResponse response = call("symbols", () -> restClient.get()
                .uri(uri -> uri.path("/symbols")
                    .queryParam("access_key", provider.getApiKey())
                    .build())
                .retrieve()
                .body(SymbolsResponse.class));

            if (response == null) {
                throw new RateSourceException(Failure.UNAVAILABLE, "Empty symbols response");
            }
            if (!response.isSuccess()) {
                throw classify(response.getError());
            }
            if (response.getSymbols() == null || response.getSymbols().isEmpty()) {
                throw new RateSourceException(Failure.UNAVAILABLE, "Provider returned no symbols");
            }
            return new LinkedHashMap<>(response.getSymbols());
        });
    }

    @Override
    public RateSourceType type() {
        return RateSourceType.LIVE;
    }

    private Rate fetchOnce(CurrencyPair pair) {
        String pivot = provider.getPivotCurrency();
        String symbols = symbolsFor(pair, pivot);

        LatestRatesResponse response = call("latest", () -> restClient.get()
            .uri(uri -> {
                uri.path("/latest").queryParam("access_key", provider.getApiKey());
                if (provider.isSendBaseParameter()) {
                    uri.queryParam("base", pivot);
                }
                return uri.queryParam("symbols", symbols).build();
            })
            .retrieve()
            .body(LatestRatesResponse.class));

        if (response == null) {
            throw new RateSourceException(Failure.UNAVAILABLE, "Empty rates response for " + pair);
        }
        if (!response.isSuccess()) {
            throw classify(response.getError());
        }

        BigDecimal pivotToSource = pivotRate(response, pair.getSource(), pivot);
        BigDecimal pivotToTarget = pivotRate(response, pair.getTarget(), pivot);
        BigDecimal midRate = CrossRates.triangulate(pivotToSource, pivotToTarget);

        log.debug("Live rate for {} via {}: {}", pair, pivot, midRate);
        return new Rate(pair, midRate, clock.instant(), RateSourceType.LIVE);
    }

    private static String symbolsFor(CurrencyPair pair, String pivot) {
        if (pair.getSource().equals(pivot)) {
            return pair.getTarget();
        }
        if (pair.getTarget().equals(pivot)) {
            return pair.getSource();
        }
        return pair.getSource() + "," + pair.getTarget();
    }

    private static BigDecimal pivotRate(LatestRatesResponse response, String currency, String pivot) {
        if (currency.equals(pivot)) {
            return BigDecimal.ONE;
        }
        BigDecimal rate = response.getRates() != null ? response.getRates().get(currency) : null;
        if (rate == null || rate.signum() <= 0) {
            throw new RateSourceException(Failure.UNAVAILABLE,
                "Provider response has no usable rate for " + pivot + "/" + currency);
        }
        return rate;
    }

    private static <T> T call(String endpoint, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            throw classify(e.getStatusCode(), endpoint);
        } catch (ResourceAccessException e) {
            throw new RateSourceException(Failure.NETWORK,
                "I/O error calling provider " + endpoint + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new RateSourceException(Failure.UNAVAILABLE,
                "Unreadable provider " + endpoint + " response: " + e.getMessage(), e);
        }
    }

    static RateSourceException classify(HttpStatusCode status, String endpoint) {
        int code = status.value();
        String message = "Provider " + endpoint + " returned HTTP " + code;
        if (code == 401 || code == 403) {
            return new RateSourceException(Failure.INVALID_KEY, message);
        }
        if (code == 429) {
            return new RateSourceException(Failure.RATE_LIMITED, message);
        }
        return new RateSourceException(Failure.UNAVAILABLE, message);
    }

    static RateSourceException classify(ProviderError error) {
        if (error == null) {
            return new RateSourceException(Failure.UNAVAILABLE, "Provider reported failure without details");
        }
        int code = error.getCode() != null ? error.getCode() : -1;
        String type = error.getType() != null ? error.getType().toLowerCase(Locale.ROOT) : "";
        String message = "Provider error " + code + " (" + type + "): " + error.getInfo();

        if (code == 101 || type.equals("invalid_access_key") || type.equals("missing_access_key")) {
            return new RateSourceException(Failure.INVALID_KEY, message);
        }
        if (code == 104 || type.equals("usage_limit_reached") || type.equals("rate_limit_reached")) {
            return new RateSourceException(Failure.RATE_LIMITED, message);
        }
        return new RateSourceException(Failure.UNAVAILABLE, message);
    }
}
