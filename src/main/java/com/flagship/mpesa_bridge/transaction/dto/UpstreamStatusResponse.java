package com.flagship.mpesa_bridge.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mpesa_bridge.daraja.StkQueryResult;
import com.flagship.mpesa_bridge.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Daraja's view of an STK push next to the locally recorded status. Purely informational.
 */
@Value
@Builder
public class UpstreamStatusResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("result_code")
    String resultCode;

    @JsonProperty("result_desc")
    String resultDesc;

    public static UpstreamStatusResponse of(UUID transactionId, TransactionStatus status, StkQueryResult result) {
        return UpstreamStatusResponse.builder()
            .transactionId(transactionId)
            .status(status)
            .resultCode(result.resultCode())
            .resultDesc(result.resultDesc())
            .build();
    }
}
