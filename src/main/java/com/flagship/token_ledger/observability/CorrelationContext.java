package com.flagship.token_ledger.observability;

import java.util.UUID;

/**
 * Header and MDC keys used to trace a request through the ledger logs.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CALLER_ADDRESS_HEADER = "X-Caller-Address";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CALLER_ADDRESS_MDC_KEY = "callerAddress";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Generates a new correlation ID.
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
