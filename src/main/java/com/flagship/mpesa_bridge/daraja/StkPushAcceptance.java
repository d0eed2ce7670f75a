package com.flagship.mpesa_bridge.daraja;

/**
 * Daraja accepted an STK push.
 *
 * @param checkoutRequestId correlation token echoed by the callback, may be null
 */
public record StkPushAcceptance(String checkoutRequestId,
                                String merchantRequestId,
                                String responseDescription,
                                String customerMessage) {
}
