package com.flagship.mpesa_bridge.outbox;

import com.flagship.mpesa_bridge.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Relays outbox events to the transactions topic.
 *
 * Each poll locks a batch, sends every event synchronously keyed by transaction id
 * (so events for one transaction stay on one partition) and marks it published only
 * after the broker acknowledged it. Events that fail {@code maxRetries} times stay in
 * the table as dead letters for manual inspection.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final String transactionsTopic;
    private final int batchSize;
    private final int maxRetries;
    private final Duration sendTimeout;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics,
                           @Value("${kafka.topic.transactions:transactions}") String transactionsTopic,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxRetries,
                           @Value("${outbox.publisher.send-timeout:10s}") Duration sendTimeout) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
        this.transactionsTopic = transactionsTopic;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
        this.sendTimeout = sendTimeout;
    }

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishable(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Relaying {} outbox events", events.size());
            events.forEach(this::publish);

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    /**
     * Sends one event and records the outcome.
     *
     * @return true if the broker acknowledged the event
     */
    boolean publish(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(transactionsTopic, event.getAggregateId().toString(), event.getPayload())
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);

            log.debug("Published outbox event {} to {}-{}@{}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted");
            return false;
        } catch (Exception e) {
            recordFailure(event, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return false;
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        log.error("Failed to publish outbox event {} ({}): {}", event.getId(), event.getEventType(), error);
        int attempts = outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (attempts >= maxRetries) {
            log.warn("Outbox event {} exhausted {} attempts and is now a dead letter, transactionId={}",
                    event.getId(), maxRetries, event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
