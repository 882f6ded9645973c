package com.flagship.fx_payments.fx;

import com.flagship.fx_payments.audit.AuditTrail;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link Quote} and {@link QuoteEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuotePersistenceService {

    private final QuoteRepository quoteRepository;
    private final AuditTrail auditTrail;

    /**
     * Stores a freshly issued quote together with its QUOTE_ISSUED audit entry.
     */
    @Transactional
    public Quote recordIssued(Quote quote) {
        QuoteEntity saved = quoteRepository.save(QuoteEntity.fromDomain(quote));
        auditTrail.recordQuoteIssued(quote);
        log.debug("Stored quote {} for {}", saved.getId(), quote.getPair());
        return quote;
    }

    @Transactional(readOnly = true)
    public Optional<Quote> findById(UUID quoteId) {
        return quoteRepository.findById(quoteId).map(QuoteEntity::toDomain);
    }

    /**
     * Non-expired quotes for a pair, newest first.
     */
    @Transactional(readOnly = true)
    public List<Quote> findActive(CurrencyPair pair, Instant now) {
        return quoteRepository
            .findBySourceCurrencyAndTargetCurrencyAndExpiresAtAfterOrderByIssuedAtDesc(
                pair.getSource(), pair.getTarget(), now)
            .stream()
            .map(QuoteEntity::toDomain)
            .toList();
    }

    /**
     * Atomically claims the quote for a payment. Runs inside the payment's transaction
     * so a rolled-back draft releases the claim.
     *
     * @return false if another payment already holds the quote
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean markConsumed(UUID quoteId, UUID paymentId, Instant now) {
        return quoteRepository.markConsumed(quoteId, paymentId, now) == 1;
    }
}
