package com.flagship.fx_payments.payment;

import com.flagship.fx_payments.exception.ConcurrentTransitionException;
import com.flagship.fx_payments.exception.PaymentNotFoundException;
import com.flagship.fx_payments.exception.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link Payment} and {@link PaymentEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;

    /**
     * Inserts a new payment and returns it as stored, i.e. with amounts rounded.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment save(Payment payment) {
        try {
            PaymentEntity saved = paymentRepository.saveAndFlush(PaymentEntity.fromDomain(payment));
            log.debug("Saved payment {}", saved.getId());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save payment " + payment.getId(), e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID paymentId) {
        return paymentRepository.findById(paymentId).map(PaymentEntity::toDomain);
    }

    /**
     * Loads a payment under a row lock held until the caller's transaction ends.
     *
     * @throws PaymentNotFoundException     if there is no such payment
     * @throws ConcurrentTransitionException if the lock could not be obtained in time
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment lockForTransition(UUID paymentId) {
        try {
            return paymentRepository.findByIdForUpdate(paymentId)
                .map(PaymentEntity::toDomain)
                .orElseThrow(() -> new PaymentNotFoundException(paymentId));
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrentTransitionException(paymentId);
        }
    }

    /**
     * Writes a transitioned payment onto the locked row and flushes, so version and
     * constraint failures surface here rather than at commit.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment applyTransition(Payment transitioned) {
        PaymentEntity entity = paymentRepository.findById(transitioned.getId())
            .orElseThrow(() -> new PaymentNotFoundException(transitioned.getId()));
        entity.applyTransition(transitioned);
        try {
            PaymentEntity updated = paymentRepository.saveAndFlush(entity);
            log.debug("Payment {} now {} (version {})", updated.getId(), updated.getStatus(), updated.getVersion());
            return updated.toDomain();
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrentTransitionException(transitioned.getId());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to update payment " + transitioned.getId(), e);
        }
    }
}
