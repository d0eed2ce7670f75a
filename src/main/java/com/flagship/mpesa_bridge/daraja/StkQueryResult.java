package com.flagship.mpesa_bridge.daraja;

/**
 * Daraja's current view of an STK push, as returned by the STK query endpoint.
 */
public record StkQueryResult(String checkoutRequestId, String resultCode, String resultDesc) {
}
