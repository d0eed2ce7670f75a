package com.flagship.mpesa_bridge.daraja;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Daraja credentials, endpoints and payment limits.
 */
@Data
@Component
@ConfigurationProperties(prefix = "mpesa")
public class MpesaProperties {

    static final String SANDBOX_URL = "https://sandbox.safaricom.co.ke";
    static final String PRODUCTION_URL = "https://api.safaricom.co.ke";

    /**
     * "sandbox" or "production".
     */
    private String environment = "sandbox";

    private String consumerKey;

    private String consumerSecret;

    /**
     * Paybill / till number, sent as BusinessShortCode and PartyB.
     */
    private String shortcode;

    /**
     * Lipa na M-Pesa Online passkey used to derive the request password.
     */
    private String passkey;

    /**
     * Zone in which Daraja expects the request timestamp.
     */
    private String timezone = "Africa/Nairobi";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(30);

    private Callback callback = new Callback();

    private C2b c2b = new C2b();

    private Limits limits = new Limits();

    public String baseUrl() {
        return "production".equalsIgnoreCase(environment) ? PRODUCTION_URL : SANDBOX_URL;
    }

    @Data
    public static class Callback {
        /**
         * Public URL Daraja posts STK results to.
         */
        private String url;

        /**
         * Shared secret appended to the callback URL as the "key" query parameter.
         * Blank disables verification.
         */
        private String secret;
    }

    @Data
    public static class C2b {
        private String confirmationUrl;
        private String validationUrl;
    }

    @Data
    public static class Limits {
        private BigDecimal minAmount = BigDecimal.ONE;
        private BigDecimal maxAmount = new BigDecimal("100000");
    }
}
