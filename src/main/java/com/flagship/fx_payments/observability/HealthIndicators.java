package com.flagship.fx_payments.observability;

import com.flagship.fx_payments.fx.RateSource;
import com.flagship.fx_payments.fx.RateSourceType;
import com.flagship.fx_payments.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Actuator health indicators for the rate source, the outbox and Kafka.
 */
public class HealthIndicators {

    /**
     * Reports which rate source is active. A live source whose latest call failed is
     * DEGRADED rather than DOWN: quotes are still served, flagged as degraded.
     */
    @Component("rateSourceHealth")
    public static class RateSourceHealthIndicator implements HealthIndicator {

        private final RateSource activeSource;
        private final QuoteMetrics quoteMetrics;

        public RateSourceHealthIndicator(@Qualifier("activeRateSource") RateSource activeSource,
                                         QuoteMetrics quoteMetrics) {
            this.activeSource = activeSource;
            this.quoteMetrics = quoteMetrics;
        }

        @Override
        public Health health() {
            Instant lastSuccess = quoteMetrics.getLastSourceSuccess();
            Instant lastFailure = quoteMetrics.getLastSourceFailure();

            boolean failingNow = activeSource.type() == RateSourceType.LIVE
                    && lastFailure != null
                    && (lastSuccess == null || lastFailure.isAfter(lastSuccess));

            Health.Builder builder = failingNow ? Health.status("DEGRADED") : Health.up();
            builder.withDetail("mode", activeSource.type().name());
            if (lastSuccess != null) {
                builder.withDetail("lastSuccess", lastSuccess.toString());
            }
            if (lastFailure != null) {
                builder.withDetail("lastFailure", lastFailure.toString())
                        .withDetail("lastFailureKind", String.valueOf(quoteMetrics.getLastFailureKind()));
            }
            return builder.build();
        }
    }

    /**
     * Unhealthy when too many payment instructions are waiting to be delivered.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka producer connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
