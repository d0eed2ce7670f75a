package com.flagship.mpesa_bridge.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.mpesa_bridge.transaction.event.TransactionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes transaction events to the outbox and tracks their publication.
 *
 * Usage: call {@link #append} inside the @Transactional method that changes the
 * transaction. If that transaction commits the event is guaranteed to be relayed;
 * if it rolls back the event disappears with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String AGGREGATE_TYPE = "Transaction";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Appends an event within the caller's transaction.
     *
     * @throws org.springframework.transaction.IllegalTransactionStateException if no transaction is active
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent append(TransactionEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.create(
            AGGREGATE_TYPE, event.getTransactionId(), event.getEventType(), serialize(event));

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Appended outbox event: type={}, transactionId={}",
                event.getEventType(), event.getTransactionId());

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishable(int limit, int maxRetries) {
        return repository.lockPublishableBatch(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            log.debug("Marked outbox event {} as published", eventId);
        });
    }

    /**
     * Records a failed publish attempt.
     *
     * @return the retry count after this failure, or 0 if the event no longer exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId)
                .map(entity -> {
                    entity.markFailed(errorMessage);
                    log.warn("Outbox event {} failed to publish (attempt #{}): {}",
                            eventId, entity.getRetryCount(), errorMessage);
                    return entity.getRetryCount();
                })
                .orElse(0);
    }

    private String serialize(TransactionEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + event.getEventType(), e);
        }
    }
}
