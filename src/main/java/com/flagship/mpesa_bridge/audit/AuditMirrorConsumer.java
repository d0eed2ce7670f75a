package com.flagship.mpesa_bridge.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.mpesa_bridge.transaction.event.TransactionCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Feeds completed transactions from the outbox topic to the {@link AuditMirror}.
 *
 * Offsets are acknowledged manually after the event is recorded as processed.
 * Mirror failures are reported by the mirror and do not block the partition.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AuditMirrorConsumer {

    static final String CONSUMER_GROUP = "audit-mirror";

    private final IdempotentEventProcessor eventProcessor;
    private final AuditMirror auditMirror;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.transactions:transactions}",
        groupId = "${spring.kafka.consumer.group-id:mpesa-bridge-audit}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        Optional<EventEnvelope> envelope = parseEnvelope(record.value());
        if (envelope.isEmpty()) {
            log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        EventEnvelope event = envelope.get();
        if (TransactionCompletedEvent.EVENT_TYPE.equals(event.eventType())) {
            eventProcessor.processEvent(event.eventId(), event.eventType(), event.transactionId(), CONSUMER_GROUP,
                    () -> auditMirror.mirror(deserialize(record.value())));
        } else {
            eventProcessor.skipEvent(event.eventId(), event.eventType(), event.transactionId(), CONSUMER_GROUP,
                    "Unknown event type");
        }

        ack.acknowledge();
    }

    Optional<EventEnvelope> parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            UUID eventId = UUID.fromString(node.path("eventId").asText());
            UUID transactionId = UUID.fromString(node.path("transactionId").asText());
            String eventType = node.path("eventType").asText("Unknown");
            return Optional.of(new EventEnvelope(eventId, transactionId, eventType));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private TransactionCompletedEvent deserialize(String json) {
        try {
            return objectMapper.readValue(json, TransactionCompletedEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize TransactionCompleted event: " + e.getMessage(), e);
        }
    }

    record EventEnvelope(UUID eventId, UUID transactionId, String eventType) {}
}
