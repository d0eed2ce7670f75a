package com.flagship.mpesa_bridge.transaction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mpesa_bridge.transaction.Transaction;
import com.flagship.mpesa_bridge.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionStatusResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("settlement_code")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String settlementCode;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionStatusResponse from(Transaction transaction) {
        return TransactionStatusResponse.builder()
            .transactionId(transaction.getId())
            .status(transaction.getStatus())
            .amount(transaction.getAmount())
            .settlementCode(transaction.getSettlementCode())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
