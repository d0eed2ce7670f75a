package com.flagship.mpesa_bridge.transaction;

/**
 * How a transaction entered the system.
 */
public enum PaymentChannel {
    /** Merchant-initiated Lipa na M-Pesa Online push, resolved by callback. */
    STK_PUSH,
    /** Customer-initiated paybill payment, created on confirmation. */
    C2B
}
