package com.flagship.mpesa_bridge.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload Daraja posts to both the C2B validation and confirmation URLs.
 * Amounts and balances arrive as strings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record C2bNotification(
        @JsonProperty("TransactionType") String transactionType,
        @JsonProperty("TransID") String transId,
        @JsonProperty("TransTime") String transTime,
        @JsonProperty("TransAmount") String transAmount,
        @JsonProperty("BusinessShortCode") String businessShortCode,
        @JsonProperty("BillRefNumber") String billRefNumber,
        @JsonProperty("InvoiceNumber") String invoiceNumber,
        @JsonProperty("OrgAccountBalance") String orgAccountBalance,
        @JsonProperty("ThirdPartyTransID") String thirdPartyTransId,
        @JsonProperty("MSISDN") String msisdn,
        @JsonProperty("FirstName") String firstName,
        @JsonProperty("MiddleName") String middleName,
        @JsonProperty("LastName") String lastName) {
}
