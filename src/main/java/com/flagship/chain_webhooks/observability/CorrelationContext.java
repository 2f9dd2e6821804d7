package com.flagship.chain_webhooks.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation ID generation plus the MDC keys used in log lines.
 *
 * Webhook requests get a correlation ID from the X-Correlation-ID header
 * (or a generated one). Processor workers tag their log lines with the
 * event, trade and network of the event they are working on.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String EVENT_ID_MDC_KEY = "eventId";
    public static final String TRADE_ID_MDC_KEY = "tradeId";
    public static final String NETWORK_MDC_KEY = "network";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts the identifiers of an event into the MDC of the current thread.
     */
    public static void putEvent(String eventId, String tradeId, String network) {
        MDC.put(EVENT_ID_MDC_KEY, eventId);
        MDC.put(TRADE_ID_MDC_KEY, tradeId);
        MDC.put(NETWORK_MDC_KEY, network);
    }

    public static void clearEvent() {
        MDC.remove(EVENT_ID_MDC_KEY);
        MDC.remove(TRADE_ID_MDC_KEY);
        MDC.remove(NETWORK_MDC_KEY);
    }
}
