package com.flagship.fx_payments.fx;

import com.flagship.fx_payments.config.FxProperties;
import com.flagship.fx_payments.exception.QuoteAlreadyUsedException;
import com.flagship.fx_payments.exception.QuoteNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Read side of quotes and the quote usage policy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuoteService {

    private final QuotePersistenceService persistenceService;
    private final FxProperties properties;
    private final Clock clock;

    public Quote get(UUID quoteId) {
        return persistenceService.findById(quoteId)
            .orElseThrow(() -> new QuoteNotFoundException(quoteId));
    }

    public long secondsRemaining(Quote quote) {
        return quote.secondsRemaining(clock.instant());
    }

    public QuoteBreakdown breakdown(Quote quote) {
        return QuoteBreakdown.of(quote);
    }

    public List<Quote> activeQuotes(CurrencyPair pair) {
        return persistenceService.findActive(pair, clock.instant());
    }

    public QuoteUsagePolicy usagePolicy() {
        return properties.getQuote().getUsagePolicy();
    }

    /**
     * Applies the usage policy for a payment about to be drafted on this quote.
     * Reusable quotes pass through; single-use quotes are claimed atomically.
     *
     * @throws QuoteAlreadyUsedException if the quote is single-use and already claimed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void claimForPayment(Quote quote, UUID paymentId) {
        if (usagePolicy() == QuoteUsagePolicy.REUSABLE) {
            return;
        }
        if (!persistenceService.markConsumed(quote.getId(), paymentId, clock.instant())) {
            log.warn("Quote {} already used; refusing payment {}", quote.getId(), paymentId);
            throw new QuoteAlreadyUsedException(quote.getId());
        }
        log.debug("Quote {} claimed by payment {}", quote.getId(), paymentId);
    }
}
