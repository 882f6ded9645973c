package com.flagship.fx_payments.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fx_payments.exception.ConcurrentTransitionException;
import com.flagship.fx_payments.exception.PaymentNotFoundException;
import com.flagship.fx_payments.exception.StateTransitionException;
import com.flagship.fx_payments.observability.CorrelationContext;
import com.flagship.fx_payments.observability.PaymentMetrics;
import com.flagship.fx_payments.payment.event.ExecutionOutcomeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Kafka consumer for execution provider status reports.
 *
 * Offsets are committed manually, after the outcome is applied or deliberately skipped:
 * <ul>
 *   <li>unreadable payloads and outcomes the payment's state does not allow are
 *       recorded as skipped and acknowledged</li>
 *   <li>lock conflicts and database errors are rethrown without acknowledgment,
 *       so the record is delivered again</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ExecutionOutcomeConsumer {

    static final String CONSUMER_GROUP = "execution-outcome-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final ExecutionOutcomeHandler outcomeHandler;
    private final PaymentMetrics paymentMetrics;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.execution-outcomes:payment-execution-outcomes}",
        groupId = "${spring.kafka.consumer.group-id:fx-payments-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        String correlationId = headerValue(record, CorrelationContext.CORRELATION_ID_HEADER);
        if (correlationId != null) {
            CorrelationContext.setCorrelationId(correlationId);
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        }

        try {
            ExecutionOutcomeEvent event = parseEvent(record.value());
            if (event == null) {
                log.warn("Could not parse execution outcome, acknowledging to skip: {}", record.value());
                paymentMetrics.recordEventProcessingFailure(ExecutionOutcomeEvent.EVENT_TYPE, "unparseable");
                ack.acknowledge();
                return;
            }

            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, event.getPaymentId().toString());
            handle(event);
            ack.acknowledge();

        } catch (Exception e) {
            log.error("Error processing message at offset {}: {}",
                    record.offset(), e.getMessage(), e);
            // not acknowledged, the record is redelivered
            throw e;
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            CorrelationContext.clear();
        }
    }

    private void handle(ExecutionOutcomeEvent event) {
        try {
            boolean applied = eventProcessor.processEvent(
                event.getEventId(), ExecutionOutcomeEvent.EVENT_TYPE,
                event.getPaymentId(), CONSUMER_GROUP,
                () -> outcomeHandler.onExecutionOutcome(event));

            paymentMetrics.recordEventProcessed(ExecutionOutcomeEvent.EVENT_TYPE, applied);
            if (applied) {
                log.info("Applied execution outcome: eventId={}, paymentId={}, outcome={}",
                        event.getEventId(), event.getPaymentId(), event.getOutcome());
            }
        } catch (ConcurrentTransitionException e) {
            throw e;
        } catch (StateTransitionException | PaymentNotFoundException e) {
            log.warn("Skipping execution outcome {} for payment {}: {}",
                    event.getOutcome(), event.getPaymentId(), e.getMessage());
            paymentMetrics.recordEventProcessingFailure(ExecutionOutcomeEvent.EVENT_TYPE, e.getCode());
            eventProcessor.skipEvent(
                event.getEventId(), ExecutionOutcomeEvent.EVENT_TYPE,
                event.getPaymentId(), CONSUMER_GROUP, e.getMessage());
        }
    }

    /**
     * @return the event, or null when the payload is unreadable or lacks an id, payment or outcome
     */
    private ExecutionOutcomeEvent parseEvent(String json) {
        if (json == null) {
            return null;
        }
        try {
            ExecutionOutcomeEvent event = objectMapper.readValue(json, ExecutionOutcomeEvent.class);
            if (event.getEventId() == null || event.getPaymentId() == null || event.getOutcome() == null) {
                return null;
            }
            return event;
        } catch (JsonProcessingException e) {
            log.error("Failed to parse execution outcome: {}", e.getMessage());
            return null;
        }
    }

    private static String headerValue(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }
}
