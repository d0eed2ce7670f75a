package com.flagship.mpesa_bridge.callback;

import com.flagship.mpesa_bridge.daraja.MpesaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the shared secret that the initiator appends to the STK callback URL.
 *
 * Daraja neither signs callbacks nor lets the caller choose headers, so the secret
 * travels as the {@code key} query parameter of the URL registered with each push.
 * Comparison is constant-time.
 */
@Component
@Slf4j
public class CallbackVerifier {

    private final byte[] expected;

    public CallbackVerifier(MpesaProperties properties) {
        String secret = properties.getCallback().getSecret();
        this.expected = secret == null || secret.isBlank() ? null : secret.getBytes(StandardCharsets.UTF_8);
        if (this.expected == null) {
            log.warn("mpesa.callback.secret is not set: STK callbacks are accepted without verification");
        }
    }

    public boolean verify(String presentedSecret) {
        if (expected == null) {
            return true;
        }
        if (presentedSecret == null) {
            return false;
        }
        return MessageDigest.isEqual(expected, presentedSecret.getBytes(StandardCharsets.UTF_8));
    }
}
