package com.flagship.fx_payments.fx;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Persistent form of an issued {@link Quote}.
 *
 * The economic columns are written once. Only the usage bookkeeping
 * ({@code consumed_by_payment_id}, {@code consumed_at}) changes afterwards,
 * and only through the conditional update in {@link QuoteRepository}.
 */
@Entity
@Table(
    name = "fx_quotes",
    indexes = {
        @Index(name = "idx_fx_quotes_pair_expires", columnList = "source_currency, target_currency, expires_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class QuoteEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "source_currency", nullable = false, updatable = false, length = 3)
    private String sourceCurrency;

    @Column(name = "target_currency", nullable = false, updatable = false, length = 3)
    private String targetCurrency;

    @Column(name = "base_rate", nullable = false, updatable = false, precision = 20, scale = 8)
    private BigDecimal baseRate;

    @Column(name = "markup_percentage", nullable = false, updatable = false, precision = 9, scale = 6)
    private BigDecimal markupPercentage;

    @Column(name = "final_rate", nullable = false, updatable = false, precision = 20, scale = 8)
    private BigDecimal finalRate;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(nullable = false, updatable = false)
    private boolean degraded;

    @Enumerated(EnumType.STRING)
    @Column(name = "rate_source", nullable = false, updatable = false, length = 10)
    private RateSourceType rateSource;

    @Column(name = "rate_fetched_at", nullable = false, updatable = false)
    private Instant rateFetchedAt;

    @Column(name = "consumed_by_payment_id")
    private UUID consumedByPaymentId;

    @Column(name = "consumed_at")
    private Instant consumedAt;

    static QuoteEntity fromDomain(Quote quote) {
        return new QuoteEntity(
            quote.getId(),
            quote.getPair().getSource(),
            quote.getPair().getTarget(),
            quote.getBaseRate(),
            quote.getMarkupPercentage(),
            quote.getFinalRate(),
            quote.getIssuedAt(),
            quote.getExpiresAt(),
            quote.isDegraded(),
            quote.getRateSource(),
            quote.getRateFetchedAt(),
            null,
            null
        );
    }

    public Quote toDomain() {
        return new Quote(
            id,
            CurrencyPair.of(sourceCurrency, targetCurrency),
            baseRate,
            markupPercentage,
            finalRate,
            issuedAt,
            expiresAt,
            degraded,
            rateSource,
            rateFetchedAt
        );
    }
}
