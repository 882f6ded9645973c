package com.flagship.fx_payments.payment;

import com.flagship.fx_payments.audit.AuditTrail;
import com.flagship.fx_payments.exception.PaymentNotFoundException;
import com.flagship.fx_payments.exception.ValidationException;
import com.flagship.fx_payments.fx.Quote;
import com.flagship.fx_payments.fx.QuoteService;
import com.flagship.fx_payments.observability.CorrelationContext;
import com.flagship.fx_payments.observability.PaymentMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Creates payment drafts from quotes.
 *
 * The quote claim (for single-use quotes), the payment row and the
 * {@code DRAFT_CREATED} audit entry are written in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    public static final String DRAFT_CREATED = "DRAFT_CREATED";
    private static final String ENTITY_TYPE = "payment";

    private final QuoteService quoteService;
    private final PaymentBuilder paymentBuilder;
    private final FeePolicy feePolicy;
    private final PaymentPersistenceService persistenceService;
    private final AuditTrail auditTrail;
    private final PaymentMetrics paymentMetrics;

    @Transactional
    public Payment createDraft(UUID quoteId, PaymentDirection direction, BigDecimal amount,
                               String reference, String createdBy) {
        long startTime = System.currentTimeMillis();
        if (AuditTrail.SYSTEM_ACTOR.equals(createdBy)) {
            throw new ValidationException("Actor id '" + AuditTrail.SYSTEM_ACTOR + "' is reserved");
        }

        Quote quote = quoteService.get(quoteId);
        Payment draft = paymentBuilder.build(quote, direction, amount, feePolicy, createdBy, reference);
        if (MoneyRounding.round(draft.getSourceAmount(), draft.getSourceCurrency()).signum() == 0
            || MoneyRounding.round(draft.getTargetAmount(), draft.getTargetCurrency()).signum() == 0) {
            throw new ValidationException("Amount is smaller than the minor unit of the payment currencies");
        }

        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, draft.getId().toString());
        try {
            quoteService.claimForPayment(quote, draft.getId());
            Payment saved = persistenceService.save(draft);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("quoteId", quote.getId().toString());
            details.put("direction", saved.getDirection().name());
            details.put("sourceAmount", saved.getSourceAmount().toPlainString());
            details.put("sourceCurrency", saved.getSourceCurrency());
            details.put("targetAmount", saved.getTargetAmount().toPlainString());
            details.put("targetCurrency", saved.getTargetCurrency());
            details.put("fxRate", saved.getFxRate().toPlainString());
            details.put("feeAmount", saved.getFeeAmount().toPlainString());
            details.put("totalDebit", saved.getTotalDebit().toPlainString());
            auditTrail.record(ENTITY_TYPE, saved.getId(), DRAFT_CREATED, createdBy, details);

            long duration = System.currentTimeMillis() - startTime;
            paymentMetrics.recordDraftCreated(saved.getSourceCurrency(), direction.name(), saved.getStatus().name());
            paymentMetrics.recordPaymentLatency("create_draft", duration);
            log.info("Draft created by {}: {} {} -> {} {} at {}, fee={}, duration={}ms",
                    createdBy, saved.getSourceAmount(), saved.getSourceCurrency(),
                    saved.getTargetAmount(), saved.getTargetCurrency(), saved.getFxRate(),
                    saved.getFeeAmount(), duration);
            return saved;
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Payment getPayment(UUID paymentId) {
        return persistenceService.findById(paymentId)
            .orElseThrow(() -> new PaymentNotFoundException(paymentId));
    }
}
