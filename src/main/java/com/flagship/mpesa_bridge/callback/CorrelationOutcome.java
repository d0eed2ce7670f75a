package com.flagship.mpesa_bridge.callback;

import com.flagship.mpesa_bridge.transaction.ErrorKind;
import com.flagship.mpesa_bridge.transaction.Transaction;

/**
 * Result of handling one STK callback.
 *
 * @param kind        why the callback was not applied; null when APPLIED
 * @param transaction the transaction after the transition; set only when APPLIED
 */
public record CorrelationOutcome(Action action, ErrorKind kind, String reason, Transaction transaction) {

    public enum Action {
        /** This delivery made the terminal transition. */
        APPLIED,
        /** Nothing changed and nothing is wrong with the request. */
        IGNORED,
        /** The request itself was unacceptable. */
        REJECTED
    }

    public static CorrelationOutcome applied(Transaction transaction) {
        return new CorrelationOutcome(Action.APPLIED, null, null, transaction);
    }

    public static CorrelationOutcome ignored(String reason) {
        return new CorrelationOutcome(Action.IGNORED, ErrorKind.CORRELATION_MISS, reason, null);
    }

    public static CorrelationOutcome unverified() {
        return new CorrelationOutcome(Action.REJECTED, ErrorKind.UNVERIFIED_CALLBACK, "callback verification failed", null);
    }

    public static CorrelationOutcome malformed(String reason) {
        return new CorrelationOutcome(Action.REJECTED, ErrorKind.MALFORMED_PAYLOAD, reason, null);
    }
}
