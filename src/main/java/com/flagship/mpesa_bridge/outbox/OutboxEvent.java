package com.flagship.mpesa_bridge.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A transaction event waiting in the outbox table to be relayed to Kafka.
 *
 * Written in the same database transaction as the state change it describes,
 * published later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null  // assigned by the database
        );
    }
}
