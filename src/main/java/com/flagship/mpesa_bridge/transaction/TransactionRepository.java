package com.flagship.mpesa_bridge.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    Optional<TransactionEntity> findByCorrelationToken(String correlationToken);

    Optional<TransactionEntity> findByIdempotencyKey(String idempotencyKey);

    Optional<TransactionEntity> findFirstBySettlementCodeAndStatus(String settlementCode, TransactionStatus status);

    long countByStatus(TransactionStatus status);

    long countByStatusAndCreatedAtBefore(TransactionStatus status, Instant cutoff);

    /**
     * Most recent transactions first, for the admin history view.
     */
    @Query(value = """
        SELECT * FROM transactions
        ORDER BY created_at DESC
        LIMIT :limit OFFSET :offset
        """, nativeQuery = true)
    List<TransactionEntity> findRecent(@Param("limit") int limit, @Param("offset") int offset);

    /**
     * Compare-and-set transition keyed by transaction id.
     *
     * Only a row that is still PENDING is touched, so among concurrent deliveries of
     * the same callback exactly one sees an update count of 1.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE TransactionEntity t
        SET t.status = :status,
            t.settlementCode = :settlementCode,
            t.failureReason = :failureReason,
            t.updatedAt = :now
        WHERE t.id = :id
        AND t.status = com.flagship.mpesa_bridge.transaction.TransactionStatus.PENDING
        """)
    int transitionIfPending(@Param("id") UUID id,
                            @Param("status") TransactionStatus status,
                            @Param("settlementCode") String settlementCode,
                            @Param("failureReason") String failureReason,
                            @Param("now") Instant now);

    /**
     * Sets the upstream correlation token on a reserved PENDING row that has none yet.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE TransactionEntity t
        SET t.correlationToken = :token,
            t.updatedAt = :now
        WHERE t.id = :id
        AND t.correlationToken IS NULL
        AND t.status = com.flagship.mpesa_bridge.transaction.TransactionStatus.PENDING
        """)
    int attachCorrelationToken(@Param("id") UUID id,
                               @Param("token") String correlationToken,
                               @Param("now") Instant now);
}
