package com.flagship.mpesa_bridge.daraja;

import lombok.Getter;

/**
 * Daraja explicitly refused a request (HTTP 4xx or a non-zero ResponseCode).
 */
@Getter
public class UpstreamRejectionException extends RuntimeException {

    private final String errorCode;

    public UpstreamRejectionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
