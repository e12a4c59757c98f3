package com.flagship.expense_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id and MDC keys shared by the HTTP filter, the write pipeline and the
 * Kafka consumer, so every log line of one request or event can be found together.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String USER_ID_MDC_KEY = "userId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * The current correlation id, generating one if none is set.
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
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId.get());
    }

    public static void putTransactionId(UUID transactionId) {
        if (transactionId != null) {
            MDC.put(TRANSACTION_ID_MDC_KEY, transactionId.toString());
        }
    }

    public static void putUserId(UUID userId) {
        if (userId != null) {
            MDC.put(USER_ID_MDC_KEY, userId.toString());
        }
    }

    /**
     * Removes the correlation id and every MDC key set through this class.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
        MDC.remove(USER_ID_MDC_KEY);
    }

    /**
     * Short form keeps log lines readable.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
