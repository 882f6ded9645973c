package com.flagship.fx_payments.approval;

import com.flagship.fx_payments.audit.ApprovalEvent;
import com.flagship.fx_payments.audit.AuditLogEntry;
import com.flagship.fx_payments.audit.AuditTrail;
import com.flagship.fx_payments.consumer.IdempotentEventProcessor;
import com.flagship.fx_payments.consumer.ProcessedEventRepository;
import com.flagship.fx_payments.exception.SelfApprovalForbiddenException;
import com.flagship.fx_payments.exception.StateTransitionException;
import com.flagship.fx_payments.fx.CurrencyPair;
import com.flagship.fx_payments.fx.Quote;
import com.flagship.fx_payments.fx.QuoteEngine;
import com.flagship.fx_payments.fx.QuotePersistenceService;
import com.flagship.fx_payments.outbox.OutboxEvent;
import com.flagship.fx_payments.outbox.OutboxService;
import com.flagship.fx_payments.payment.Payment;
import com.flagship.fx_payments.payment.PaymentDirection;
import com.flagship.fx_payments.payment.PaymentService;
import com.flagship.fx_payments.payment.PaymentStatus;
import com.flagship.fx_payments.payment.event.ExecutionOutcomeEvent;
import com.flagship.fx_payments.payment.event.PaymentApprovedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end approval workflow against a real database.
 *
 * These tests verify:
 * - A quoted draft moves through submit and approve, with history, audit and outbox rows
 * - Self-approval leaves the payment untouched
 * - Execution outcomes are applied once per event id
 * - Concurrent checker decisions on one payment: exactly one wins
 * - A single-use quote can only be claimed once
 */
@SpringBootTest
@Testcontainers
class ApprovalWorkflowIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("fx_payments_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("fx.provider.api-key", () -> "");
    }

    private static final String MAKER = "user42";
    private static final String CHECKER = "user7";
    private static final String CONSUMER_GROUP = "workflow-test";

    @Autowired
    private QuoteEngine quoteEngine;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private ApprovalStateMachine stateMachine;

    @Autowired
    private AuditTrail auditTrail;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository processedEventRepository;

    @Autowired
    private QuotePersistenceService quotePersistenceService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private Quote quote;

    @BeforeEach
    void setUp() {
        quote = quoteEngine.request(CurrencyPair.of("GBP", "EUR"));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private Payment pendingPayment() {
        Payment draft = paymentService.createDraft(quote.getId(), PaymentDirection.SEND,
            new BigDecimal("1000.00"), "INV-1001", MAKER);
        return stateMachine.submit(draft.getId(), MAKER);
    }

    @Test
    @DisplayName("Quote, draft, submit and approve leave a full trail")
    void testHappyPath_FullTrail() {
        printTestHeader("Quote -> Draft -> Submit -> Approve");

        Payment pending = pendingPayment();
        assertEquals(PaymentStatus.PENDING_APPROVAL, pending.getStatus());

        Payment approved = stateMachine.approve(pending.getId(), CHECKER, "looks right");
        System.out.println("Payment: " + approved.getId() + " status=" + approved.getStatus());
        assertEquals(PaymentStatus.APPROVED, approved.getStatus());
        assertEquals(0, quote.getFinalRate().compareTo(approved.getFxRate()));

        List<ApprovalEvent> history = stateMachine.history(approved.getId());
        assertEquals(2, history.size());
        assertEquals(ApprovalAction.SUBMIT, history.get(0).getAction());
        assertEquals(MAKER, history.get(0).getActorId());
        assertEquals(ApprovalAction.APPROVE, history.get(1).getAction());
        assertEquals(CHECKER, history.get(1).getActorId());
        assertEquals("looks right", history.get(1).getComment());

        List<OutboxEvent> outbox = outboxService.getEventsForAggregate("Payment", approved.getId());
        assertEquals(1, outbox.size());
        assertEquals(PaymentApprovedEvent.EVENT_TYPE, outbox.get(0).getEventType());
        assertNull(outbox.get(0).getPublishedAt());

        List<AuditLogEntry> quoteAudit = auditTrail.entriesFor("quote", quote.getId());
        assertTrue(quoteAudit.stream().anyMatch(e -> AuditTrail.QUOTE_ISSUED.equals(e.getAction())));
        List<AuditLogEntry> paymentAudit = auditTrail.entriesFor("payment", approved.getId());
        assertTrue(paymentAudit.stream().anyMatch(e -> PaymentService.DRAFT_CREATED.equals(e.getAction())
            && MAKER.equals(e.getActorId())));

        printSuccess("Approval recorded with history, audit and one outbox event");
    }

    @Test
    @DisplayName("Creator cannot approve their own payment")
    void testSelfApproval_LeavesStateUnchanged() {
        printTestHeader("Self Approval Forbidden");

        Payment pending = pendingPayment();

        assertThrows(SelfApprovalForbiddenException.class,
            () -> stateMachine.approve(pending.getId(), MAKER, null));

        assertEquals(PaymentStatus.PENDING_APPROVAL, paymentService.getPayment(pending.getId()).getStatus());
        assertEquals(1, stateMachine.history(pending.getId()).size());
        assertTrue(outboxService.getEventsForAggregate("Payment", pending.getId()).isEmpty());

        printSuccess("Self approval refused, nothing recorded");
    }

    @Test
    @DisplayName("Execution outcomes run through to COMPLETED and duplicates are ignored")
    void testExecutionOutcomes_DuplicateIgnored() {
        printTestHeader("Execution Outcomes - Duplicate Event");

        Payment pending = pendingPayment();
        UUID paymentId = stateMachine.approve(pending.getId(), CHECKER, null).getId();

        UUID submittedEventId = UUID.randomUUID();
        AtomicInteger handlerCalls = new AtomicInteger(0);
        Runnable submitted = () -> {
            handlerCalls.incrementAndGet();
            stateMachine.recordExecutionOutcome(paymentId, ExecutionOutcome.SUBMITTED, "EXT-77", null);
        };

        assertTrue(eventProcessor.processEvent(submittedEventId, ExecutionOutcomeEvent.EVENT_TYPE,
            paymentId, CONSUMER_GROUP, submitted));
        assertFalse(eventProcessor.processEvent(submittedEventId, ExecutionOutcomeEvent.EVENT_TYPE,
            paymentId, CONSUMER_GROUP, submitted));
        assertEquals(1, handlerCalls.get());

        stateMachine.recordExecutionOutcome(paymentId, ExecutionOutcome.PROCESSING, null, null);
        Payment completed = stateMachine.recordExecutionOutcome(paymentId, ExecutionOutcome.COMPLETED, null, null);

        assertEquals(PaymentStatus.COMPLETED, completed.getStatus());
        assertEquals("EXT-77", completed.getExternalReference());
        assertEquals(5, stateMachine.history(paymentId).size());
        assertEquals(1, processedEventRepository.findByPaymentIdOrderByProcessedAtAsc(paymentId).size());

        printSuccess("Outcome applied once, payment completed");
    }

    @Test
    @DisplayName("Concurrent approve and reject on one payment: exactly one succeeds")
    void testConcurrentDecisions_ExactlyOneWins() throws Exception {
        printTestHeader("Concurrent Approve / Reject");

        UUID paymentId = pendingPayment().getId();
        int threads = 2;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger successes = new AtomicInteger(0);
        AtomicInteger refusals = new AtomicInteger(0);

        for (int i = 0; i < threads; i++) {
            final boolean approve = i == 0;
            executor.submit(() -> {
                try {
                    start.await();
                    if (approve) {
                        stateMachine.approve(paymentId, CHECKER, null);
                    } else {
                        stateMachine.reject(paymentId, "user9", "duplicate invoice");
                    }
                    successes.incrementAndGet();
                } catch (StateTransitionException e) {
                    refusals.incrementAndGet();
                } catch (Exception e) {
                    System.out.println("Unexpected: " + e);
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        System.out.println("Successes: " + successes.get() + ", refusals: " + refusals.get());
        assertEquals(1, successes.get());
        assertEquals(1, refusals.get());

        PaymentStatus finalStatus = paymentService.getPayment(paymentId).getStatus();
        assertTrue(finalStatus == PaymentStatus.APPROVED || finalStatus == PaymentStatus.REJECTED);
        assertEquals(2, stateMachine.history(paymentId).size());

        printSuccess("One decision recorded, final status " + finalStatus);
    }

    @Test
    @DisplayName("A quote can be marked consumed only once")
    void testMarkConsumed_OnlyOnce() {
        printTestHeader("Quote Claimed Once");

        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        Boolean claimed = transactionTemplate.execute(
            status -> quotePersistenceService.markConsumed(quote.getId(), first, Instant.now()));
        Boolean claimedAgain = transactionTemplate.execute(
            status -> quotePersistenceService.markConsumed(quote.getId(), second, Instant.now()));

        assertEquals(Boolean.TRUE, claimed);
        assertEquals(Boolean.FALSE, claimedAgain);

        printSuccess("Second claim refused");
    }
}
