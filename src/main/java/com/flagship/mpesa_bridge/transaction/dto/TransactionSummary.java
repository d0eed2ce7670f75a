package com.flagship.mpesa_bridge.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mpesa_bridge.transaction.PaymentChannel;
import com.flagship.mpesa_bridge.transaction.Transaction;
import com.flagship.mpesa_bridge.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One row of the admin payment history.
 */
@Value
@Builder
public class TransactionSummary {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("phone_number")
    String phoneNumber;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("channel")
    PaymentChannel channel;

    @JsonProperty("settlement_code")
    String settlementCode;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TransactionSummary from(Transaction transaction) {
        return TransactionSummary.builder()
            .transactionId(transaction.getId())
            .phoneNumber(transaction.getPhoneNumber())
            .amount(transaction.getAmount())
            .status(transaction.getStatus())
            .channel(transaction.getChannel())
            .settlementCode(transaction.getSettlementCode())
            .failureReason(transaction.getFailureReason())
            .createdAt(transaction.getCreatedAt())
            .updatedAt(transaction.getUpdatedAt())
            .build();
    }
}
