package com.flagship.mpesa_bridge.transaction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InitiationResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    /**
     * "initiated", "failed" or "error".
     */
    @JsonProperty("status")
    String status;

    @JsonProperty("error")
    String error;

    @JsonProperty("message")
    String message;
}
