package com.flagship.mpesa_bridge.audit;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an event, so redelivery after a crash
 * or rebalance does not mirror the same transaction twice.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    UUID transactionId;
    String consumerGroup;
    Instant processedAt;
    Outcome outcome;
    String detail;

    public enum Outcome {
        /** Handler ran; detail carries its result. */
        HANDLED,
        /** Event not relevant to this consumer. */
        SKIPPED
    }

    public static ProcessedEvent handled(UUID eventId, String eventType, UUID transactionId,
                                         String consumerGroup, String detail) {
        return new ProcessedEvent(eventId, eventType, transactionId, consumerGroup,
                Instant.now(), Outcome.HANDLED, detail);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, UUID transactionId,
                                         String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, transactionId, consumerGroup,
                Instant.now(), Outcome.SKIPPED, reason);
    }
}
