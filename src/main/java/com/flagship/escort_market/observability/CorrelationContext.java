package com.flagship.escort_market.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local context for correlation ID propagation.
 *
 * The correlation ID comes from the {@code X-Correlation-ID} request header or is
 * generated, and is carried into every log line through MDC together with the
 * order and user being worked on.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ORDER_ID_MDC_KEY = "orderId";
    public static final String USER_ID_MDC_KEY = "userId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
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

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void putOrderId(UUID orderId) {
        if (orderId != null) {
            MDC.put(ORDER_ID_MDC_KEY, orderId.toString());
        }
    }

    public static void putUserId(UUID userId) {
        if (userId != null) {
            MDC.put(USER_ID_MDC_KEY, userId.toString());
        }
    }

    public static void clearSubjects() {
        MDC.remove(ORDER_ID_MDC_KEY);
        MDC.remove(USER_ID_MDC_KEY);
    }
}
