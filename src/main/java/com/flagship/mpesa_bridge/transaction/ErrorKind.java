package com.flagship.mpesa_bridge.transaction;

/**
 * Why an operation did not complete normally. Controllers map each kind to a
 * response shape; services never build HTTP responses themselves.
 */
public enum ErrorKind {
    /** Malformed phone number or out-of-range amount. No network call was made. */
    VALIDATION,
    /** Daraja unreachable, timed out or answered 5xx. Not retried. */
    UPSTREAM_TRANSIENT,
    /** Daraja refused the request. The transaction is recorded as FAILED. */
    UPSTREAM_REJECTED,
    /** A callback token matched no pending transaction. */
    CORRELATION_MISS,
    /** A callback failed shared-secret verification. */
    UNVERIFIED_CALLBACK,
    /** A request body could not be parsed. */
    MALFORMED_PAYLOAD
}
