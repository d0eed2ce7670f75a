package com.flagship.mpesa_bridge.inbound;

/**
 * Business rules for accepting an incoming C2B payment before Daraja posts it,
 * such as bill reference checks, amount limits or duplicate suppression.
 */
public interface InboundValidationPolicy {

    /**
     * @return true to let Daraja complete the payment
     */
    boolean accept(C2bNotification notification);
}
