package com.flagship.mpesa_bridge.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the payment flows.
 *
 * Metrics exposed:
 * - transactions.initiated{outcome}: STK push initiation results
 * - transactions.callbacks{action}: callback correlation results
 * - transactions.inbound{phase,result}: C2B validate/confirm results
 * - upstream.latency{operation}: Daraja and Notion round trips
 * - audit.mirror{result}: audit mirror deliveries
 * - idempotency.cache{result}: initiation idempotency lookups
 */
@Component
public class TransactionMetrics {

    private final MeterRegistry registry;

    public TransactionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordInitiation(String outcome) {
        registry.counter("transactions.initiated",
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordCallback(String action) {
        registry.counter("transactions.callbacks",
                "action", sanitizeTag(action)
        ).increment();
    }

    public void recordInbound(String phase, String result) {
        registry.counter("transactions.inbound",
                "phase", sanitizeTag(phase),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordUpstreamLatency(String operation, Duration duration) {
        registry.timer("upstream.latency",
                "operation", sanitizeTag(operation)
        ).record(duration);
    }

    public void recordAuditMirror(String result) {
        registry.counter("audit.mirror",
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
