package com.flagship.finance_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Thread-local correlation ID plus the MDC keys used in ledger logs.
 *
 * The correlation ID ties together every log line of one caller command, including the
 * per-account postings a journal entry fans out to. {@code entityKey} names the entity
 * whose lock the current thread holds.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ENTITY_KEY_MDC_KEY = "entityKey";
    public static final String ORGANIZATION_ID_MDC_KEY = "organizationId";

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

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Runs work with the correlation ID and organization in the MDC, reusing an ID already
     * set on this thread. Only the outermost call clears what it set.
     */
    public static <T> T withContext(String organizationId, Supplier<T> work) {
        boolean outermost = correlationId.get() == null;
        String previousOrganization = MDC.get(ORGANIZATION_ID_MDC_KEY);
        MDC.put(CORRELATION_ID_MDC_KEY, getCorrelationId());
        MDC.put(ORGANIZATION_ID_MDC_KEY, organizationId);
        try {
            return work.get();
        } finally {
            if (previousOrganization != null) {
                MDC.put(ORGANIZATION_ID_MDC_KEY, previousOrganization);
            } else {
                MDC.remove(ORGANIZATION_ID_MDC_KEY);
            }
            if (outermost) {
                MDC.remove(CORRELATION_ID_MDC_KEY);
                clear();
            }
        }
    }

    /**
     * Shorter than a full UUID for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
