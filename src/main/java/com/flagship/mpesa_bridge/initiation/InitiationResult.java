package com.flagship.mpesa_bridge.initiation;

import com.flagship.mpesa_bridge.transaction.ErrorKind;
import com.flagship.mpesa_bridge.transaction.TransactionStatus;

import java.util.UUID;

/**
 * Outcome of an STK push initiation.
 *
 * @param transactionId  null only for validation failures, which persist nothing
 * @param recordedStatus status the transaction was stored with
 * @param error          null when the push was accepted
 */
public record InitiationResult(UUID transactionId,
                               TransactionStatus recordedStatus,
                               ErrorKind error,
                               String message) {

    public static InitiationResult accepted(UUID transactionId, String message) {
        return new InitiationResult(transactionId, TransactionStatus.PENDING, null, message);
    }

    public static InitiationResult invalid(String message) {
        return new InitiationResult(null, null, ErrorKind.VALIDATION, message);
    }

    public static InitiationResult rejected(UUID transactionId, String message) {
        return new InitiationResult(transactionId, TransactionStatus.FAILED, ErrorKind.UPSTREAM_REJECTED, message);
    }

    public static InitiationResult unavailable(UUID transactionId, TransactionStatus recordedStatus, String message) {
        return new InitiationResult(transactionId, recordedStatus, ErrorKind.UPSTREAM_TRANSIENT, message);
    }

    public boolean isAccepted() {
        return error == null;
    }
}
