package com.flagship.mpesa_bridge.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs an event handler at most once per consumer group.
 *
 * The handler result is stored with the processed marker. A handler that throws
 * leaves no marker, so the event is redelivered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType, UUID transactionId,
                                String consumerGroup, Supplier<?> handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        Object result = handler.get();
        record(ProcessedEvent.handled(eventId, eventType, transactionId, consumerGroup, String.valueOf(result)));

        log.debug("Processed event {} by consumer group {}: {}", eventId, consumerGroup, result);
        return true;
    }

    /**
     * Marks an event this consumer does not handle, so it is not looked at again.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType, UUID transactionId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        record(ProcessedEvent.skipped(eventId, eventType, transactionId, consumerGroup, reason));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void record(ProcessedEvent event) {
        repository.save(ProcessedEventEntity.fromDomain(event));
    }
}
