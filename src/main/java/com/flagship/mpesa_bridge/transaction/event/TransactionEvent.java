package com.flagship.mpesa_bridge.transaction.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for transaction events written to the outbox.
 */
public interface TransactionEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * The transaction this event is about.
     */
    UUID getTransactionId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
