package com.flagship.mpesa_bridge.transaction;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a transaction.
 *
 * PENDING is the only non-terminal state. STK push transactions start there and
 * move exactly once to SUCCESS or FAILED when the callback arrives. C2B
 * transactions are created directly in SUCCESS.
 */
public enum TransactionStatus {
    /**
     * STK push accepted (or outcome unknown), waiting for the callback.
     */
    PENDING,

    /**
     * Payment completed upstream.
     * Terminal state - no further transitions allowed.
     */
    SUCCESS,

    /**
     * Rejected at initiation, or the callback reported a non-zero result code.
     * Terminal state - no further transitions allowed.
     */
    FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
