package com.flagship.mpesa_bridge.daraja;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Base64;

/**
 * Time-boxed secret for Lipa na M-Pesa Online requests.
 *
 * password = Base64(shortcode + passkey + timestamp), where the timestamp is
 * yyyyMMddHHmmss in East Africa Time and must be sent alongside the password.
 */
public record RequestPassword(String timestamp, String password) {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    public static RequestPassword derive(String shortcode, String passkey, Instant now, ZoneId zone) {
        String timestamp = TIMESTAMP_FORMAT.format(now.atZone(zone));
        String raw = shortcode + passkey + timestamp;
        String password = Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
        return new RequestPassword(timestamp, password);
    }
}
