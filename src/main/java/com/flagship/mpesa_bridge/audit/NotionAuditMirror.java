package com.flagship.mpesa_bridge.audit;

import com.flagship.mpesa_bridge.observability.TransactionMetrics;
import com.flagship.mpesa_bridge.transaction.event.TransactionCompletedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one Notion database page per completed transaction.
 *
 * The database needs these properties: Payment ID (title), Phone Number (phone),
 * Amount (number), Transaction Code (rich text), Status (select), Created At and
 * Updated At (date).
 */
@Component
@Slf4j
public class NotionAuditMirror implements AuditMirror {

    static final String PAGES_PATH = "/pages";
    static final String NO_SETTLEMENT_CODE = "N/A";

    private final RestClient restClient;
    private final NotionProperties properties;
    private final TransactionMetrics metrics;

    public NotionAuditMirror(@Qualifier("notionRestClient") RestClient restClient,
                             NotionProperties properties,
                             TransactionMetrics metrics) {
        this.restClient = restClient;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public MirrorResult mirror(TransactionCompletedEvent event) {
        MirrorResult result = send(event);
        metrics.recordAuditMirror(result.name());
        return result;
    }

    private MirrorResult send(TransactionCompletedEvent event) {
        if (!properties.isConfigured()) {
            log.debug("Notion not configured, skipping audit mirror for {}", event.getTransactionId());
            return MirrorResult.NOT_CONFIGURED;
        }

        try {
            restClient.post()
                    .uri(PAGES_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                    .header("Notion-Version", properties.getVersion())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(pageFor(event))
                    .retrieve()
                    .toBodilessEntity();

            log.info("Mirrored transaction {} ({}) to Notion", event.getTransactionId(), event.getStatus());
            return MirrorResult.MIRRORED;

        } catch (RestClientException e) {
            log.warn("Failed to mirror transaction {} to Notion: {}", event.getTransactionId(), e.getMessage());
            return MirrorResult.FAILED;
        }
    }

    Map<String, Object> pageFor(TransactionCompletedEvent event) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("Payment ID", Map.of("title", List.of(text(event.getTransactionId().toString()))));
        props.put("Phone Number", Map.of("phone_number", event.getPhoneNumber()));
        props.put("Amount", Map.of("number", event.getAmount()));
        props.put("Transaction Code", Map.of("rich_text", List.of(text(
                event.getSettlementCode() != null ? event.getSettlementCode() : NO_SETTLEMENT_CODE))));
        props.put("Status", Map.of("select", Map.of("name", capitalize(event.getStatus().wireValue()))));
        props.put("Created At", date(event.getCreatedAt()));
        props.put("Updated At", date(event.getUpdatedAt()));

        Map<String, Object> page = new LinkedHashMap<>();
        page.put("parent", Map.of("database_id", properties.getDatabaseId()));
        page.put("properties", props);
        return page;
    }

    private static Map<String, Object> text(String content) {
        return Map.of("text", Map.of("content", content));
    }

    private static Map<String, Object> date(Instant instant) {
        return Map.of("date", Map.of("start", (instant != null ? instant : Instant.now()).toString()));
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
