package com.flagship.mpesa_bridge.daraja;

/**
 * Daraja could not be reached, timed out, answered 5xx or returned an unusable body.
 * Nothing here is retried automatically; the caller decides what the failure means.
 */
public class UpstreamTransientException extends RuntimeException {

    public UpstreamTransientException(String message) {
        super(message);
    }

    public UpstreamTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
