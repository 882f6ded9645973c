package com.flagship.fx_payments.fx;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface QuoteRepository extends JpaRepository<QuoteEntity, UUID> {

    List<QuoteEntity> findBySourceCurrencyAndTargetCurrencyAndExpiresAtAfterOrderByIssuedAtDesc(
        String sourceCurrency, String targetCurrency, Instant now);

    /**
     * Claims a quote for a payment. Returns 1 if the claim succeeded, 0 if the quote
     * was already claimed. The WHERE clause makes check-and-mark a single statement.
     */
    @Modifying
    @Query("UPDATE QuoteEntity q SET q.consumedByPaymentId = :paymentId, q.consumedAt = :now " +
           "WHERE q.id = :quoteId AND q.consumedByPaymentId IS NULL")
    int markConsumed(@Param("quoteId") UUID quoteId,
                     @Param("paymentId") UUID paymentId,
                     @Param("now") Instant now);
}
