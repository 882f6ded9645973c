package com.flagship.fx_payments.payment;

import com.flagship.fx_payments.approval.ApprovalStateMachine;
import com.flagship.fx_payments.observability.CorrelationContext;
import com.flagship.fx_payments.payment.dto.ApprovalActionRequest;
import com.flagship.fx_payments.payment.dto.ApprovalEventResponse;
import com.flagship.fx_payments.payment.dto.CreatePaymentRequest;
import com.flagship.fx_payments.payment.dto.PaymentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Payment drafts and the maker-checker actions on them.
 *
 * Every mutating call names its actor in the {@code X-Actor-Id} header.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentService paymentService;
    private final ApprovalStateMachine stateMachine;

    @PostMapping
    public ResponseEntity<PaymentResponse> createPayment(
            @Valid @RequestBody CreatePaymentRequest request,
            @RequestHeader(CorrelationContext.ACTOR_ID_HEADER) String actorId) {

        log.info("Received draft request: quoteId={}, direction={}, amount={}",
                request.getQuoteId(), request.getDirection(), request.getAmount());

        Payment payment = paymentService.createDraft(
            request.getQuoteId(),
            request.getDirection(),
            request.getAmount(),
            request.getReference(),
            actorId);

        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(PaymentResponse.from(paymentService.getPayment(id)));
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<PaymentResponse> submit(
            @PathVariable("id") UUID id,
            @RequestHeader(CorrelationContext.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody(required = false) ApprovalActionRequest request) {
        return ResponseEntity.ok(PaymentResponse.from(stateMachine.submit(id, actorId, comment(request))));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<PaymentResponse> approve(
            @PathVariable("id") UUID id,
            @RequestHeader(CorrelationContext.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody(required = false) ApprovalActionRequest request) {
        return ResponseEntity.ok(PaymentResponse.from(stateMachine.approve(id, actorId, comment(request))));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<PaymentResponse> reject(
            @PathVariable("id") UUID id,
            @RequestHeader(CorrelationContext.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody(required = false) ApprovalActionRequest request) {
        return ResponseEntity.ok(PaymentResponse.from(stateMachine.reject(id, actorId, comment(request))));
    }

    @GetMapping("/{id}/approvals")
    public ResponseEntity<List<ApprovalEventResponse>> approvals(@PathVariable("id") UUID id) {
        List<ApprovalEventResponse> events = stateMachine.history(id)
            .stream()
            .map(ApprovalEventResponse::from)
            .toList();
        return ResponseEntity.ok(events);
    }

    private static String comment(ApprovalActionRequest request) {
        return request == null ? null : request.getComment();
    }
}
