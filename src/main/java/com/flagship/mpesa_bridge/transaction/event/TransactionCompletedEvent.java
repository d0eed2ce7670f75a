package com.flagship.mpesa_bridge.transaction.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mpesa_bridge.transaction.PaymentChannel;
import com.flagship.mpesa_bridge.transaction.Transaction;
import com.flagship.mpesa_bridge.transaction.TransactionStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a transaction reaches a terminal state, either through a callback
 * or by a C2B confirmation. Carries the full final state so that consumers such as
 * the audit mirror never read back from the database.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransactionCompletedEvent implements TransactionEvent {
    UUID eventId;
    UUID transactionId;
    String phoneNumber;
    BigDecimal amount;
    TransactionStatus status;
    String settlementCode;
    PaymentChannel channel;
    Instant createdAt;
    Instant updatedAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionCompleted";

    @JsonCreator
    public TransactionCompletedEvent(@JsonProperty("eventId") UUID eventId,
                                     @JsonProperty("transactionId") UUID transactionId,
                                     @JsonProperty("phoneNumber") String phoneNumber,
                                     @JsonProperty("amount") BigDecimal amount,
                                     @JsonProperty("status") TransactionStatus status,
                                     @JsonProperty("settlementCode") String settlementCode,
                                     @JsonProperty("channel") PaymentChannel channel,
                                     @JsonProperty("createdAt") Instant createdAt,
                                     @JsonProperty("updatedAt") Instant updatedAt,
                                     @JsonProperty("occurredAt") Instant occurredAt) {
        this.eventId = eventId;
        this.transactionId = transactionId;
        this.phoneNumber = phoneNumber;
        this.amount = amount;
        this.status = status;
        this.settlementCode = settlementCode;
        this.channel = channel;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.occurredAt = occurredAt;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionCompletedEvent from(Transaction transaction) {
        if (!transaction.isTerminal()) {
            throw new IllegalArgumentException(
                "Transaction " + transaction.getId() + " is not terminal: " + transaction.getStatus());
        }
        return new TransactionCompletedEvent(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getPhoneNumber(),
            transaction.getAmount(),
            transaction.getStatus(),
            transaction.getSettlementCode(),
            transaction.getChannel(),
            transaction.getCreatedAt(),
            transaction.getUpdatedAt(),
            Instant.now()
        );
    }
}
