package com.flagship.mpesa_bridge.observability;

import java.util.UUID;

/**
 * MDC keys and trace-id helpers shared by the request filter, the Kafka consumer
 * and the services that tag log lines with a transaction id.
 *
 * The trace id identifies one inbound HTTP request or Kafka record. It is unrelated
 * to the upstream correlation token (CheckoutRequestID) used to match callbacks.
 */
public final class TraceContext {

    public static final String TRACE_ID_HEADER = "X-Correlation-ID";
    public static final String TRACE_ID_MDC_KEY = "traceId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";

    private TraceContext() {
    }

    /**
     * Short form for readability in logs.
     */
    public static String newTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static String orNew(String traceId) {
        return traceId == null || traceId.isBlank() ? newTraceId() : traceId;
    }
}
