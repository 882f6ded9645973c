package com.flagship.fx_payments.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fx_payments.exception.PersistenceException;
import com.flagship.fx_payments.fx.Quote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit of quote issue and payment transitions.
 *
 * Both write methods require a caller transaction (MANDATORY propagation): an
 * audit row is committed together with the change it describes or not at all.
 * There is no update or delete path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditTrail {

    public static final String QUOTE_ISSUED = "QUOTE_ISSUED";
    public static final String SYSTEM_ACTOR = "system";

    private final ApprovalEventRepository approvalEventRepository;
    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Appends one transition to a payment's approval history.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ApprovalEvent append(ApprovalEvent event) {
        try {
            ApprovalEventEntity saved = approvalEventRepository.saveAndFlush(ApprovalEventEntity.fromDomain(event));
            log.debug("Appended approval event {} {} -> {} by {}",
                event.getAction(), event.getFromStatus(), event.getToStatus(), event.getActorId());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to append approval event for payment " + event.getPaymentId(), e);
        }
    }

    /**
     * Records a general audit entry.
     *
     * @param details serialised as a JSON object
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditLogEntry record(String entityType, UUID entityId, String action,
                                String actorId, Map<String, Object> details) {
        AuditLogEntry entry = new AuditLogEntry(
            UUID.randomUUID(), actorId, entityType, entityId, action, toJson(details), clock.instant());
        try {
            return auditLogRepository.save(AuditLogEntity.fromDomain(entry)).toDomain();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to record " + action + " for " + entityType + " " + entityId, e);
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditLogEntry recordQuoteIssued(Quote quote) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pair", quote.getPair().toString());
        details.put("base_rate", quote.getBaseRate().toPlainString());
        details.put("markup_percentage", quote.getMarkupPercentage().toPlainString());
        details.put("final_rate", quote.getFinalRate().toPlainString());
        details.put("expires_at", quote.getExpiresAt().toString());
        details.put("rate_source", quote.getRateSource().name());
        details.put("degraded", quote.isDegraded());
        return record("quote", quote.getId(), QUOTE_ISSUED, SYSTEM_ACTOR, details);
    }

    /**
     * Approval history of a payment, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ApprovalEvent> history(UUID paymentId) {
        return approvalEventRepository.findByPaymentIdOrderBySequenceNumberAsc(paymentId)
            .stream()
            .map(ApprovalEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<AuditLogEntry> entriesFor(String entityType, UUID entityId) {
        return auditLogRepository.findByEntityTypeAndEntityIdOrderByCreatedAtAsc(entityType, entityId)
            .stream()
            .map(AuditLogEntity::toDomain)
            .toList();
    }

    private String toJson(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details == null ? Map.of() : details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit details", e);
        }
    }
}
