package com.flagship.fx_payments.outbox;

import com.flagship.fx_payments.observability.CorrelationContext;
import com.flagship.fx_payments.observability.OutboxMetrics;
import com.flagship.fx_payments.payment.event.PaymentApprovedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Polls the outbox and delivers events to Kafka.
 *
 * Payment approvals go to the payment-instructions topic, keyed by payment id so the
 * execution provider sees one payment's events in order. Each send is awaited before
 * the event is marked published; a failed send bumps the retry count and the event
 * is picked up again on a later poll until it reaches {@code outbox.publisher.max-retries}.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "eventType";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.payment-instructions:payment-instructions}")
    private String instructionsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findDeliverable(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Delivering {} outbox events", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        try {
            ProducerRecord<String, String> record = new ProducerRecord<>(
                topicFor(event), event.getAggregateId().toString(), event.getPayload());
            record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
            if (event.getCorrelationId() != null) {
                record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                    event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
            }

            SendResult<String, String> result = kafkaTemplate.send(record).get();

            log.debug("Published {} for {} to {}-{}@{}",
                event.getEventType(), event.getAggregateId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish {} {}: {}", event.getEventType(), event.getId(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Outbox event {} reached {} attempts and will not be retried", event.getId(), maxRetries);
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    private String topicFor(OutboxEvent event) {
        if (PaymentApprovedEvent.EVENT_TYPE.equals(event.getEventType())) {
            return instructionsTopic;
        }
        throw new IllegalStateException("No topic configured for outbox event type " + event.getEventType());
    }
}
