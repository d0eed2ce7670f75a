package com.flagship.mpesa_bridge.inbound;

import org.springframework.stereotype.Component;

/**
 * Default policy: every well-formed incoming payment is accepted.
 */
@Component
public class AcceptAllValidationPolicy implements InboundValidationPolicy {

    @Override
    public boolean accept(C2bNotification notification) {
        return true;
    }
}
