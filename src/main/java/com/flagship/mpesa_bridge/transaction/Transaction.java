package com.flagship.mpesa_bridge.transaction;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Transaction domain object.
 *
 * Key principles:
 * - Identity, payer and amount never change after creation
 * - Status transitions are explicit and validated
 * - Every transition returns a new Transaction
 */
@Value
public class Transaction {

    /** Column widths of the transactions table. */
    public static final int MAX_SETTLEMENT_CODE_LENGTH = 64;
    public static final int MAX_FAILURE_REASON_LENGTH = 255;
    public static final int MAX_ACCOUNT_REFERENCE_LENGTH = 64;
    public static final int MAX_PHONE_NUMBER_LENGTH = 64;

    UUID id;
    String correlationToken;
    String phoneNumber;
    BigDecimal amount;
    TransactionStatus status;
    String settlementCode;
    String failureReason;
    PaymentChannel channel;
    String accountReference;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a PENDING STK push transaction. The correlation token may be null when
     * the upstream response carried none or the submission outcome is unknown.
     */
    public static Transaction pending(UUID id, String phoneNumber, BigDecimal amount, String correlationToken) {
        Instant now = Instant.now();
        return new Transaction(
            id,
            correlationToken,
            phoneNumber,
            amount,
            TransactionStatus.PENDING,
            null,
            null,
            PaymentChannel.STK_PUSH,
            null,
            now,
            now
        );
    }

    /**
     * Creates a C2B transaction directly in SUCCESS. It never passes through PENDING
     * and carries no correlation token. Payer and bill reference are free text from
     * the customer's side and are cut to their column widths.
     *
     * @throws IllegalArgumentException if the settlement code is longer than a receipt can be
     */
    public static Transaction confirmedInbound(UUID id, String phoneNumber, BigDecimal amount,
                                               String settlementCode, String accountReference) {
        requireSettlementCodeFits(settlementCode);
        Instant now = Instant.now();
        return new Transaction(
            id,
            null,
            truncate(phoneNumber, MAX_PHONE_NUMBER_LENGTH),
            amount,
            TransactionStatus.SUCCESS,
            settlementCode,
            null,
            PaymentChannel.C2B,
            truncate(accountReference, MAX_ACCOUNT_REFERENCE_LENGTH),
            now,
            now
        );
    }

    /**
     * Transitions to SUCCESS. Only valid from PENDING.
     *
     * @param settlementCode upstream receipt, may be null
     * @throws IllegalStateException if the transaction is already terminal
     * @throws IllegalArgumentException if the settlement code is longer than a receipt can be
     */
    public Transaction succeed(String settlementCode) {
        requireTransition(TransactionStatus.SUCCESS, "complete");
        requireSettlementCodeFits(settlementCode);
        return new Transaction(
            this.id,
            this.correlationToken,
            this.phoneNumber,
            this.amount,
            TransactionStatus.SUCCESS,
            settlementCode,
            null,
            this.channel,
            this.accountReference,
            this.createdAt,
            Instant.now()
        );
    }

    /**
     * Transitions to FAILED. Only valid from PENDING. Upstream descriptions are
     * unbounded, so the reason is cut to {@link #MAX_FAILURE_REASON_LENGTH}.
     *
     * @throws IllegalStateException if the transaction is already terminal
     */
    public Transaction fail(String reason) {
        requireTransition(TransactionStatus.FAILED, "fail");
        return new Transaction(
            this.id,
            this.correlationToken,
            this.phoneNumber,
            this.amount,
            TransactionStatus.FAILED,
            null,
            truncate(reason, MAX_FAILURE_REASON_LENGTH),
            this.channel,
            this.accountReference,
            this.createdAt,
            Instant.now()
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Checks if a transition from the current status to the target status is allowed.
     */
    public boolean canTransitionTo(TransactionStatus targetStatus) {
        return switch (this.status) {
            case PENDING -> targetStatus == TransactionStatus.SUCCESS || targetStatus == TransactionStatus.FAILED;
            case SUCCESS, FAILED -> false;
        };
    }

    /**
     * True for codes that fit the settlement code column. Null counts as fitting.
     */
    public static boolean isStorableSettlementCode(String settlementCode) {
        return settlementCode == null || settlementCode.length() <= MAX_SETTLEMENT_CODE_LENGTH;
    }

    private static void requireSettlementCodeFits(String settlementCode) {
        if (!isStorableSettlementCode(settlementCode)) {
            throw new IllegalArgumentException(
                "Settlement code longer than " + MAX_SETTLEMENT_CODE_LENGTH + " characters");
        }
    }

    private static String truncate(String value, int maxLength) {
        return value == null || value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private void requireTransition(TransactionStatus target, String action) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot %s transaction %s in %s status. Only PENDING transactions can transition.",
                    action, this.id, this.status)
            );
        }
    }
}
