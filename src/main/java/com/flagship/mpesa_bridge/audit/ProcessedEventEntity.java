package com.flagship.mpesa_bridge.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "processed_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedEventEntity {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "transaction_id")
    private UUID transactionId;

    @Column(name = "consumer_group", nullable = false, length = 100)
    private String consumerGroup;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 20)
    private ProcessedEvent.Outcome outcome;

    @Column(name = "detail", columnDefinition = "TEXT")
    private String detail;

    static ProcessedEventEntity fromDomain(ProcessedEvent event) {
        ProcessedEventEntity entity = new ProcessedEventEntity();
        entity.eventId = event.getEventId();
        entity.eventType = event.getEventType();
        entity.transactionId = event.getTransactionId();
        entity.consumerGroup = event.getConsumerGroup();
        entity.processedAt = event.getProcessedAt();
        entity.outcome = event.getOutcome();
        entity.detail = event.getDetail();
        return entity;
    }

    public ProcessedEvent toDomain() {
        return new ProcessedEvent(eventId, eventType, transactionId, consumerGroup, processedAt, outcome, detail);
    }
}
