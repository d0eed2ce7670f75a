package com.flagship.mpesa_bridge.transaction.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request body for starting an STK push. Format and range checks happen in the
 * initiator so that they share one error path with upstream failures.
 */
@Value
public class InitiatePaymentRequest {

    @NotBlank(message = "Phone number is required")
    @JsonProperty("phone")
    String phone;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonCreator
    public InitiatePaymentRequest(@JsonProperty("phone") String phone,
                                  @JsonProperty("amount") BigDecimal amount) {
        this.phone = phone;
        this.amount = amount;
    }
}
