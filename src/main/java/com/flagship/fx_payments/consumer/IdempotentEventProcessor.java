package com.flagship.fx_payments.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Runs an event handler at most once per (event id, consumer group).
 *
 * The handler and the processed_events row share one transaction: if the handler
 * throws, neither the payment change nor the marker is kept and the event can be
 * delivered again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    /**
     * @return true if the handler ran, false if the event was already processed
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType, UUID paymentId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping",
                    eventId, consumerGroup);
            return false;
        }

        handler.run();

        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.applied(
            eventId, eventType, paymentId, consumerGroup, clock.instant())));

        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Marks an event as dealt with without applying it, so redelivery does not retry it.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType, UUID paymentId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }

        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.skipped(
            eventId, eventType, paymentId, consumerGroup, clock.instant(), reason)));

        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
