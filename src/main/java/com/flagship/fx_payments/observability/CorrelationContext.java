package com.flagship.fx_payments.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the service.
 *
 * The id arrives on HTTP requests and Kafka records (header {@code X-Correlation-ID})
 * or is generated, and is written to every log line through the MDC.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String ACTOR_ID_HEADER = "X-Actor-Id";

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PAYMENT_ID_MDC_KEY = "paymentId";
    public static final String QUOTE_ID_MDC_KEY = "quoteId";
    public static final String ACTOR_ID_MDC_KEY = "actorId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current correlation id; one is generated on first access if none was set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    // Short form keeps log lines readable.
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
