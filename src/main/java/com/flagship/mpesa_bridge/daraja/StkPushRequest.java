package com.flagship.mpesa_bridge.daraja;

import java.math.BigDecimal;

/**
 * What the initiator asks Daraja to push to the payer's phone.
 *
 * @param accountReference shown to the payer and echoed back in statements
 */
public record StkPushRequest(String phoneNumber,
                             BigDecimal amount,
                             String accountReference,
                             String description,
                             String callbackUrl) {
}
