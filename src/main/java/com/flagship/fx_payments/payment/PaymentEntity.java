package com.flagship.fx_payments.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for payments.
 *
 * No setters: the economic columns are insert-only, and status, external reference
 * and failure reason change only through {@link #applyTransition}. Amounts are rounded
 * to their currency's minor unit on the way in. {@code @Version} backs up the row lock
 * taken for every transition.
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_status", columnList = "status"),
        @Index(name = "idx_payments_created_by", columnList = "created_by")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "quote_id", updatable = false)
    private UUID quoteId;

    @Column(name = "source_currency", nullable = false, updatable = false, length = 3)
    private String sourceCurrency;

    @Column(name = "target_currency", nullable = false, updatable = false, length = 3)
    private String targetCurrency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private PaymentDirection direction;

    @Column(name = "source_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal sourceAmount;

    @Column(name = "target_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal targetAmount;

    @Column(name = "fx_rate", nullable = false, updatable = false, precision = 20, scale = 8)
    private BigDecimal fxRate;

    @Column(name = "fee_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal feeAmount;

    @Column(name = "total_debit", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal totalDebit;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private PaymentStatus status;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(length = 255, updatable = false)
    private String reference;

    @Column(name = "external_reference", length = 100)
    private String externalReference;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }

    @PreUpdate
    void onUpdate() {
        if (this.updatedAt == null) {
            this.updatedAt = Instant.now();
        }
    }

    /**
     * Only way to create an entity. Rounds every amount to its currency's minor unit.
     */
    static PaymentEntity fromDomain(Payment payment) {
        String source = payment.getSourceCurrency();
        BigDecimal sourceAmount = MoneyRounding.round(payment.getSourceAmount(), source);
        BigDecimal feeAmount = MoneyRounding.round(payment.getFeeAmount(), source);
        return new PaymentEntity(
            payment.getId(),
            payment.getQuoteId(),
            source,
            payment.getTargetCurrency(),
            payment.getDirection(),
            sourceAmount,
            MoneyRounding.round(payment.getTargetAmount(), payment.getTargetCurrency()),
            payment.getFxRate(),
            feeAmount,
            // Sum of the rounded parts, so the stored total always adds up.
            sourceAmount.add(feeAmount),
            payment.getStatus(),
            payment.getCreatedBy(),
            payment.getReference(),
            payment.getExternalReference(),
            payment.getFailureReason(),
            payment.getCreatedAt(),
            payment.getUpdatedAt(),
            null
        );
    }

    public Payment toDomain() {
        return new Payment(
            id,
            quoteId,
            sourceCurrency,
            targetCurrency,
            direction,
            sourceAmount,
            targetAmount,
            fxRate,
            feeAmount,
            totalDebit,
            status,
            createdBy,
            reference,
            externalReference,
            failureReason,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable part of a transitioned payment onto this row.
     */
    void applyTransition(Payment payment) {
        this.status = payment.getStatus();
        this.externalReference = payment.getExternalReference();
        this.failureReason = payment.getFailureReason();
        this.updatedAt = payment.getUpdatedAt();
    }
}
