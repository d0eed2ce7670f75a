package com.flagship.mpesa_bridge.transaction;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the transactions table.
 *
 * No setters: status, settlement code and failure reason only change through the
 * conditional update in {@link TransactionRepository#transitionIfPending}. The
 * correlation token is set once, by {@link TransactionRepository#attachCorrelationToken}.
 *
 * Implements {@link Persistable} so that saving a freshly built entity is always an
 * INSERT. A colliding transaction id surfaces as a constraint violation instead of
 * silently merging over the existing row.
 */
@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_transactions_correlation_token", columnList = "correlation_token", unique = true),
        @Index(name = "idx_transactions_phone_amount", columnList = "phone_number, amount"),
        @Index(name = "idx_transactions_status", columnList = "status"),
        @Index(name = "idx_transactions_created_at", columnList = "created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity implements Persistable<UUID> {

    @Id
    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "correlation_token", unique = true, length = 100)
    private String correlationToken;

    @Column(name = "phone_number", nullable = false, updatable = false, length = 64)
    private String phoneNumber;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionStatus status;

    @Column(name = "settlement_code", length = 64)
    private String settlementCode;

    @Column(name = "failure_reason")
    private String failureReason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private PaymentChannel channel;

    @Column(name = "account_reference", updatable = false, length = 64)
    private String accountReference;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    private boolean isNew;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    /**
     * Controlled factory: the only way to create TransactionEntity instances.
     *
     * The idempotency key is a persistence concern and is passed separately.
     */
    static TransactionEntity fromDomain(Transaction transaction, String idempotencyKey) {
        return new TransactionEntity(
            transaction.getId(),
            transaction.getCorrelationToken(),
            transaction.getPhoneNumber(),
            transaction.getAmount(),
            transaction.getStatus(),
            transaction.getSettlementCode(),
            transaction.getFailureReason(),
            transaction.getChannel(),
            transaction.getAccountReference(),
            idempotencyKey,
            null, // createdAt - set by @PrePersist
            null, // updatedAt - set by @PrePersist
            true
        );
    }

    public Transaction toDomain() {
        return new Transaction(
            id,
            correlationToken,
            phoneNumber,
            amount,
            status,
            settlementCode,
            failureReason,
            channel,
            accountReference,
            createdAt,
            updatedAt
        );
    }
}
