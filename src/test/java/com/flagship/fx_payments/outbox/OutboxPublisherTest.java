package com.flagship.fx_payments.outbox;

import com.flagship.fx_payments.observability.CorrelationContext;
import com.flagship.fx_payments.observability.OutboxMetrics;
import com.flagship.fx_payments.payment.event.PaymentApprovedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Delivery of outbox events to Kafka, with the outbox and the broker mocked out.
 *
 * These tests verify that:
 * - Approvals go to the payment-instructions topic keyed by payment id
 * - Event type and correlation id travel as headers
 * - A successful send marks the event published
 * - A failed send counts a retry, and the last allowed attempt is dead-lettered
 */
class OutboxPublisherTest {

    private static final String TOPIC = "payment-instructions";
    private static final int MAX_RETRIES = 3;

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private SimpleMeterRegistry meterRegistry;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        meterRegistry = new SimpleMeterRegistry();
        publisher = new OutboxPublisher(outboxService, kafkaTemplate,
            new OutboxMetrics(mock(OutboxEventRepository.class), meterRegistry));
        ReflectionTestUtils.setField(publisher, "instructionsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 50);
        ReflectionTestUtils.setField(publisher, "maxRetries", MAX_RETRIES);
    }

    private static OutboxEvent pending(String eventType, int retryCount) {
        UUID paymentId = UUID.randomUUID();
        return new OutboxEvent(UUID.randomUUID(), "Payment", paymentId, eventType,
            "{\"paymentId\":\"" + paymentId + "\"}", "corr-42", Instant.now(), null, retryCount, null, 1L);
    }

    private static String header(ProducerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }

    @SuppressWarnings("unchecked")
    private void brokerAccepts() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenAnswer(invocation -> {
            ProducerRecord<String, String> record = invocation.getArgument(0);
            RecordMetadata metadata = new RecordMetadata(new TopicPartition(record.topic(), 1), 7L, 0,
                System.currentTimeMillis(), 36, record.value().length());
            return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
        });
    }

    @SuppressWarnings("unchecked")
    private void brokerRejects() {
        when(kafkaTemplate.send(any(ProducerRecord.class)))
            .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker unavailable")));
    }

    private double counter(String name, String... tags) {
        return meterRegistry.counter(name, tags).count();
    }

    @Test
    @DisplayName("Approvals are sent to the instructions topic keyed by payment id, then marked published")
    @SuppressWarnings("unchecked")
    void testPublish_RoutesAndMarksPublished() {
        OutboxEvent event = pending(PaymentApprovedEvent.EVENT_TYPE, 0);
        when(outboxService.findDeliverable(50, MAX_RETRIES)).thenReturn(List.of(event));
        brokerAccepts();

        publisher.publishPendingEvents();

        ArgumentCaptor<ProducerRecord<String, String>> sent = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(sent.capture());
        ProducerRecord<String, String> record = sent.getValue();
        assertEquals(TOPIC, record.topic());
        assertEquals(event.getAggregateId().toString(), record.key());
        assertEquals(event.getPayload(), record.value());
        assertEquals(PaymentApprovedEvent.EVENT_TYPE, header(record, OutboxPublisher.EVENT_TYPE_HEADER));
        assertEquals("corr-42", header(record, CorrelationContext.CORRELATION_ID_HEADER));

        verify(outboxService).markPublished(event.getId());
        verify(outboxService, never()).markFailed(any(), anyString());
        assertEquals(1.0, counter("outbox.events.published",
            "event_type", PaymentApprovedEvent.EVENT_TYPE, "status", "success"));
    }

    @Test
    @DisplayName("Each event in a batch is sent in sequence order")
    @SuppressWarnings("unchecked")
    void testPublish_BatchInOrder() {
        OutboxEvent first = pending(PaymentApprovedEvent.EVENT_TYPE, 0);
        OutboxEvent second = pending(PaymentApprovedEvent.EVENT_TYPE, 0);
        when(outboxService.findDeliverable(50, MAX_RETRIES)).thenReturn(List.of(first, second));
        brokerAccepts();

        publisher.publishPendingEvents();

        ArgumentCaptor<ProducerRecord<String, String>> sent = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate, times(2)).send(sent.capture());
        assertEquals(first.getAggregateId().toString(), sent.getAllValues().get(0).key());
        assertEquals(second.getAggregateId().toString(), sent.getAllValues().get(1).key());
        verify(outboxService).markPublished(first.getId());
        verify(outboxService).markPublished(second.getId());
    }

    @Test
    @DisplayName("A failed send records the error and leaves the event for the next poll")
    void testPublish_FailureCountsRetry() {
        OutboxEvent event = pending(PaymentApprovedEvent.EVENT_TYPE, 0);
        when(outboxService.findDeliverable(50, MAX_RETRIES)).thenReturn(List.of(event));
        brokerRejects();

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxService, never()).markPublished(any());
        assertEquals(1.0, counter("outbox.events.published",
            "event_type", PaymentApprovedEvent.EVENT_TYPE, "status", "failure"));
        assertEquals(0.0, counter("outbox.events.dead_lettered", "event_type", PaymentApprovedEvent.EVENT_TYPE));
    }

    @Test
    @DisplayName("Failing the last allowed attempt dead-letters the event")
    void testPublish_LastAttemptDeadLettered() {
        OutboxEvent event = pending(PaymentApprovedEvent.EVENT_TYPE, MAX_RETRIES - 1);
        when(outboxService.findDeliverable(50, MAX_RETRIES)).thenReturn(List.of(event));
        brokerRejects();

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        assertEquals(1.0, counter("outbox.events.dead_lettered", "event_type", PaymentApprovedEvent.EVENT_TYPE));
    }

    @Test
    @DisplayName("Event types without a topic are marked failed and never sent")
    @SuppressWarnings("unchecked")
    void testPublish_UnroutableEventType() {
        OutboxEvent event = pending("PaymentArchived", 0);
        when(outboxService.findDeliverable(50, MAX_RETRIES)).thenReturn(List.of(event));

        publisher.publishPendingEvents();

        verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
        verify(outboxService).markFailed(eq(event.getId()), anyString());
    }

    @Test
    @DisplayName("An empty outbox sends nothing")
    @SuppressWarnings("unchecked")
    void testPublish_NothingPending() {
        when(outboxService.findDeliverable(50, MAX_RETRIES)).thenReturn(List.of());

        publisher.publishPendingEvents();

        verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
        verify(outboxService, never()).markPublished(any());
    }
}
