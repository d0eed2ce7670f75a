package com.flagship.mpesa_bridge.callback;

import com.flagship.mpesa_bridge.daraja.MpesaProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CallbackVerifierTest {

    private static CallbackVerifier verifierWithSecret(String secret) {
        MpesaProperties properties = new MpesaProperties();
        properties.getCallback().setSecret(secret);
        return new CallbackVerifier(properties);
    }

    @Test
    @DisplayName("Matching key verifies, anything else does not")
    void comparesSecret() {
        CallbackVerifier verifier = verifierWithSecret("s3cret");

        assertTrue(verifier.verify("s3cret"));
        assertFalse(verifier.verify("s3cret-"));
        assertFalse(verifier.verify(""));
        assertFalse(verifier.verify(null));
    }

    @Test
    @DisplayName("Without a configured secret every callback passes")
    void disabledWithoutSecret() {
        CallbackVerifier verifier = verifierWithSecret(" ");

        assertTrue(verifier.verify(null));
        assertTrue(verifier.verify("anything"));
    }
}
