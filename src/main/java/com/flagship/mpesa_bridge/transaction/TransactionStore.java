package com.flagship.mpesa_bridge.transaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable keyed storage for transactions.
 *
 * Bridges the domain layer (Transaction) and the persistence layer (TransactionEntity).
 * Holds no business rules beyond the atomic primitives the flows rely on:
 * insert-only create, the status-conditioned terminal update and attaching the
 * correlation token to a reserved row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionStore {

    private final TransactionRepository transactionRepository;

    /**
     * Inserts a new transaction. Flushes immediately so a duplicate id, token or
     * idempotency key fails here rather than at commit.
     *
     * @param idempotencyKey optional client key, may be null
     * @throws org.springframework.dao.DataIntegrityViolationException on any unique collision
     */
    @Transactional
    public Transaction create(Transaction transaction, String idempotencyKey) {
        TransactionEntity saved = transactionRepository.saveAndFlush(
            TransactionEntity.fromDomain(transaction, idempotencyKey));
        log.debug("Stored transaction {} status={} channel={}",
                saved.getId(), saved.getStatus(), saved.getChannel());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Transaction> findById(UUID transactionId) {
        return transactionRepository.findById(transactionId)
            .map(TransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Transaction> findByCorrelationToken(String correlationToken) {
        return transactionRepository.findByCorrelationToken(correlationToken)
            .map(TransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Transaction> findByIdempotencyKey(String idempotencyKey) {
        return transactionRepository.findByIdempotencyKey(idempotencyKey)
            .map(TransactionEntity::toDomain);
    }

    /**
     * Finds a completed transaction by upstream receipt. Used to recognise redelivered
     * C2B confirmations.
     */
    @Transactional(readOnly = true)
    public Optional<Transaction> findSuccessfulBySettlementCode(String settlementCode) {
        return transactionRepository.findFirstBySettlementCodeAndStatus(settlementCode, TransactionStatus.SUCCESS)
            .map(TransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Transaction> findRecent(int limit, int offset) {
        return transactionRepository.findRecent(limit, offset)
            .stream()
            .map(TransactionEntity::toDomain)
            .toList();
    }

    /**
     * Persists a terminal transition if and only if the stored row is still PENDING.
     *
     * Must run inside the caller's transaction so that the completion event written
     * next commits or rolls back together with the status change.
     *
     * @param completed the result of {@link Transaction#succeed} or {@link Transaction#fail}
     * @return the stored transaction when this call made the transition, empty when
     *         the row was no longer PENDING
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Transaction> completeIfPending(Transaction completed) {
        return transition(completed);
    }

    /**
     * Records a failure that produces no completion event, such as a push Daraja
     * refused. Runs in its own transaction when the caller has none.
     *
     * @return the stored transaction, empty if the row was no longer PENDING
     */
    @Transactional
    public Optional<Transaction> failIfPending(Transaction failed) {
        if (failed.getStatus() != TransactionStatus.FAILED) {
            throw new IllegalArgumentException("Expected a FAILED transaction, got " + failed.getStatus());
        }
        return transition(failed);
    }

    /**
     * Attaches the upstream correlation token to a reserved PENDING row.
     *
     * @return true if the token was set, false if the row already had one or is terminal
     * @throws org.springframework.dao.DataIntegrityViolationException if another row carries the token
     */
    @Transactional
    public boolean attachCorrelationToken(UUID transactionId, String correlationToken) {
        return transactionRepository.attachCorrelationToken(transactionId, correlationToken, Instant.now()) == 1;
    }

    private Optional<Transaction> transition(Transaction target) {
        if (!target.isTerminal()) {
            throw new IllegalArgumentException("Target status must be terminal: " + target.getStatus());
        }

        int updated = transactionRepository.transitionIfPending(
            target.getId(), target.getStatus(), target.getSettlementCode(), target.getFailureReason(),
            target.getUpdatedAt());

        if (updated == 0) {
            return Optional.empty();
        }

        return transactionRepository.findById(target.getId())
            .map(TransactionEntity::toDomain);
    }
}
