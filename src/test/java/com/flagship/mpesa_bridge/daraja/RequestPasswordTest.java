package com.flagship.mpesa_bridge.daraja;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class RequestPasswordTest {

    @Test
    @DisplayName("Timestamp is rendered in Nairobi time and folded into the password")
    void derivesPassword() {
        Instant now = Instant.parse("2024-01-15T09:30:05Z");

        RequestPassword password = RequestPassword.derive("174379", "passkey", now, ZoneId.of("Africa/Nairobi"));

        assertEquals("20240115123005", password.timestamp());
        String decoded = new String(Base64.getDecoder().decode(password.password()), StandardCharsets.UTF_8);
        assertEquals("174379passkey20240115123005", decoded);
    }

    @Test
    @DisplayName("Day rolls over when Nairobi is already past midnight")
    void dayRollover() {
        Instant now = Instant.parse("2024-03-31T22:15:00Z");

        RequestPassword password = RequestPassword.derive("600000", "k", now, ZoneId.of("Africa/Nairobi"));

        assertEquals("20240401011500", password.timestamp());
    }
}
