package com.flagship.fx_payments.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ApprovalEventRepository extends JpaRepository<ApprovalEventEntity, UUID> {

    List<ApprovalEventEntity> findByPaymentIdOrderBySequenceNumberAsc(UUID paymentId);

    long countByPaymentId(UUID paymentId);
}
