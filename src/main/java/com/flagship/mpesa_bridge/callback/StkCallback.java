package com.flagship.mpesa_bridge.callback;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The fields of a Daraja STK callback that correlation needs.
 *
 * <pre>
 * {"Body": {"stkCallback": {
 *     "MerchantRequestID": "...", "CheckoutRequestID": "...",
 *     "ResultCode": 0, "ResultDesc": "...",
 *     "CallbackMetadata": {"Item": [{"Name": "MpesaReceiptNumber", "Value": "..."}, ...]}}}}
 * </pre>
 *
 * @param resultCode null when absent or not an integer
 * @param receiptNumber value of the MpesaReceiptNumber metadata item, if any
 */
public record StkCallback(Integer resultCode,
                          String resultDesc,
                          String checkoutRequestId,
                          String merchantRequestId,
                          String receiptNumber) {

    static final String RECEIPT_ITEM = "MpesaReceiptNumber";

    public static StkCallback from(JsonNode root) {
        JsonNode callback = root.path("Body").path("stkCallback");

        return new StkCallback(
                parseResultCode(callback.path("ResultCode")),
                text(callback.path("ResultDesc")),
                text(callback.path("CheckoutRequestID")),
                text(callback.path("MerchantRequestID")),
                findItem(callback.path("CallbackMetadata").path("Item"), RECEIPT_ITEM));
    }

    /**
     * Exactly zero is success; anything else, including a missing code, is failure.
     */
    public boolean isSuccess() {
        return resultCode != null && resultCode == 0;
    }

    public boolean hasCorrelationToken() {
        return checkoutRequestId != null;
    }

    /**
     * Integral numbers, including floats such as {@code 0.0}, and numeric strings.
     */
    private static Integer parseResultCode(JsonNode node) {
        if (node.isNumber()) {
            try {
                return node.decimalValue().intValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String findItem(JsonNode items, String name) {
        if (!items.isArray()) {
            return null;
        }
        for (JsonNode item : items) {
            if (name.equals(item.path("Name").asText())) {
                return text(item.path("Value"));
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
