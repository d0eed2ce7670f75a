package com.flagship.mpesa_bridge.daraja;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.mpesa_bridge.observability.TransactionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * HTTP client for the Safaricom Daraja API.
 *
 * Failure classification:
 * - I/O errors, timeouts, 5xx and unusable bodies: {@link UpstreamTransientException}
 * - 4xx and non-zero ResponseCode: {@link UpstreamRejectionException}
 */
@Component
@Slf4j
public class DarajaClient {

    static final String TOKEN_PATH = "/oauth/v1/generate?grant_type=client_credentials";
    static final String STK_PUSH_PATH = "/mpesa/stkpush/v1/processrequest";
    static final String STK_QUERY_PATH = "/mpesa/stkpushquery/v1/query";
    static final String C2B_REGISTER_PATH = "/mpesa/c2b/v1/registerurl";

    private static final String ACCEPTED = "0";

    private final RestClient restClient;
    private final MpesaProperties properties;
    private final ObjectMapper objectMapper;
    private final TransactionMetrics metrics;
    private final Clock clock;

    public DarajaClient(@Qualifier("darajaRestClient") RestClient restClient,
                        MpesaProperties properties,
                        ObjectMapper objectMapper,
                        TransactionMetrics metrics,
                        Clock clock) {
        this.restClient = restClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Obtains a short-lived OAuth access token. Every failure is transient from the
     * caller's point of view, including a rejected credential pair.
     */
    public String fetchAccessToken() {
        String credentials = properties.getConsumerKey() + ":" + properties.getConsumerSecret();
        String basic = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));

        JsonNode body;
        try {
            body = timed("oauth", () -> restClient.get()
                    .uri(TOKEN_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Basic " + basic)
                    .retrieve()
                    .body(JsonNode.class));
        } catch (RestClientException e) {
            throw new UpstreamTransientException("Failed to obtain Daraja access token: " + e.getMessage(), e);
        }

        String token = body != null ? body.path("access_token").asText("") : "";
        if (token.isBlank()) {
            throw new UpstreamTransientException("Daraja token response carried no access_token");
        }
        return token;
    }

    /**
     * Submits an STK push.
     *
     * @return the acceptance, whose checkout request id may be null
     * @throws UpstreamRejectionException if Daraja refused the push
     * @throws UpstreamTransientException if the outcome is unknown
     */
    public StkPushAcceptance requestStkPush(StkPushRequest request, String accessToken) {
        RequestPassword password = newPassword();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("BusinessShortCode", properties.getShortcode());
        payload.put("Password", password.password());
        payload.put("Timestamp", password.timestamp());
        payload.put("TransactionType", "CustomerPayBillOnline");
        payload.put("Amount", request.amount().setScale(0, RoundingMode.DOWN).intValue());
        payload.put("PartyA", request.phoneNumber());
        payload.put("PartyB", properties.getShortcode());
        payload.put("PhoneNumber", request.phoneNumber());
        payload.put("CallBackURL", request.callbackUrl());
        payload.put("AccountReference", request.accountReference());
        payload.put("TransactionDesc", request.description());

        JsonNode body = post("stk_push", STK_PUSH_PATH, payload, accessToken);

        String responseCode = body.path("ResponseCode").asText("");
        if (!ACCEPTED.equals(responseCode)) {
            throw new UpstreamRejectionException(
                    responseCode.isEmpty() ? null : responseCode,
                    body.path("ResponseDescription").asText("STK push not accepted"));
        }

        return new StkPushAcceptance(
                textOrNull(body, "CheckoutRequestID"),
                textOrNull(body, "MerchantRequestID"),
                textOrNull(body, "ResponseDescription"),
                textOrNull(body, "CustomerMessage"));
    }

    /**
     * Asks Daraja for the current result of an STK push. Read-only.
     */
    public StkQueryResult queryStkStatus(String checkoutRequestId) {
        String accessToken = fetchAccessToken();
        RequestPassword password = newPassword();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("BusinessShortCode", properties.getShortcode());
        payload.put("Password", password.password());
        payload.put("Timestamp", password.timestamp());
        payload.put("CheckoutRequestID", checkoutRequestId);

        JsonNode body = post("stk_query", STK_QUERY_PATH, payload, accessToken);

        return new StkQueryResult(
                checkoutRequestId,
                textOrNull(body, "ResultCode"),
                textOrNull(body, "ResultDesc"));
    }

    /**
     * Registers the C2B validation and confirmation URLs for the configured shortcode.
     *
     * @return Daraja's response body
     */
    public JsonNode registerC2bUrls(String confirmationUrl, String validationUrl) {
        String accessToken = fetchAccessToken();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ShortCode", properties.getShortcode());
        payload.put("ResponseType", "Completed");
        payload.put("ConfirmationURL", confirmationUrl);
        payload.put("ValidationURL", validationUrl);

        JsonNode body = post("c2b_register", C2B_REGISTER_PATH, payload, accessToken);
        log.info("Registered C2B URLs for shortcode {}: {}",
                properties.getShortcode(), body.path("ResponseDescription").asText(""));
        return body;
    }

    private JsonNode post(String operation, String path, Map<String, Object> payload, String accessToken) {
        try {
            ResponseEntity<JsonNode> response = timed(operation, () -> restClient.post()
                    .uri(path)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .toEntity(JsonNode.class));

            if (response.getBody() == null) {
                throw new UpstreamTransientException("Empty Daraja response for " + operation);
            }
            return response.getBody();

        } catch (HttpClientErrorException e) {
            JsonNode error = parseQuietly(e.getResponseBodyAsString());
            String code = textOrNull(error, "errorCode");
            String message = error.path("errorMessage").asText(e.getStatusText());
            log.warn("Daraja rejected {}: status={}, errorCode={}, message={}",
                    operation, e.getStatusCode().value(), code, message);
            throw new UpstreamRejectionException(code, message);

        } catch (HttpServerErrorException e) {
            throw new UpstreamTransientException(
                    "Daraja " + operation + " failed with status " + e.getStatusCode().value(), e);

        } catch (ResourceAccessException e) {
            throw new UpstreamTransientException("Daraja " + operation + " unreachable: " + e.getMessage(), e);

        } catch (RestClientException e) {
            throw new UpstreamTransientException("Daraja " + operation + " returned an unusable response", e);
        }
    }

    private <T> T timed(String operation, Supplier<T> call) {
        long start = System.nanoTime();
        try {
            return call.get();
        } finally {
            metrics.recordUpstreamLatency(operation, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private RequestPassword newPassword() {
        return RequestPassword.derive(
                properties.getShortcode(),
                properties.getPasskey(),
                clock.instant(),
                ZoneId.of(properties.getTimezone()));
    }

    private JsonNode parseQuietly(String body) {
        try {
            return body == null || body.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(body);
        } catch (Exception e) {
            log.debug("Daraja error body is not JSON: {}", body);
            return objectMapper.createObjectNode();
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() || value.asText().isBlank() ? null : value.asText();
    }
}
