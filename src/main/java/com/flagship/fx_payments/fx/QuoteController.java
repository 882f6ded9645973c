package com.flagship.fx_payments.fx;

import com.flagship.fx_payments.fx.dto.CreateQuoteRequest;
import com.flagship.fx_payments.fx.dto.QuoteResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/quotes")
@RequiredArgsConstructor
@Slf4j
public class QuoteController {

    private final QuoteEngine quoteEngine;
    private final QuoteService quoteService;

    /**
     * Issues a quote. Omitting the markup uses the configured default.
     */
    @PostMapping
    public ResponseEntity<QuoteResponse> createQuote(@Valid @RequestBody CreateQuoteRequest request) {
        CurrencyPair pair = CurrencyPair.of(request.getSourceCurrency(), request.getTargetCurrency());
        log.info("Received quote request for {}", pair);

        Quote quote = request.getMarkupPercentage() == null
            ? quoteEngine.request(pair)
            : quoteEngine.request(pair, request.getMarkupPercentage());

        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(quote));
    }

    @GetMapping("/{id}")
    public ResponseEntity<QuoteResponse> getQuote(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(toResponse(quoteService.get(id)));
    }

    @GetMapping
    public ResponseEntity<List<QuoteResponse>> activeQuotes(@RequestParam("source") String source,
                                                            @RequestParam("target") String target) {
        List<QuoteResponse> quotes = quoteService.activeQuotes(CurrencyPair.of(source, target))
            .stream()
            .map(this::toResponse)
            .toList();
        return ResponseEntity.ok(quotes);
    }

    @GetMapping("/currencies")
    public ResponseEntity<Map<String, List<String>>> currencies() {
        return ResponseEntity.ok(Map.of("currencies", quoteEngine.supportedCurrencies()));
    }

    private QuoteResponse toResponse(Quote quote) {
        return QuoteResponse.from(quote, quoteService.breakdown(quote), quoteService.secondsRemaining(quote));
    }
}
