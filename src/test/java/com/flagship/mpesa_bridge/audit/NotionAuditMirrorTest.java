package com.flagship.mpesa_bridge.audit;

import com.flagship.mpesa_bridge.observability.TransactionMetrics;
import com.flagship.mpesa_bridge.transaction.Transaction;
import com.flagship.mpesa_bridge.transaction.event.TransactionCompletedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class NotionAuditMirrorTest {

    private static final String BASE = "https://api.notion.com/v1";

    private MockRestServiceServer server;
    private NotionProperties properties;
    private NotionAuditMirror mirror;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new NotionProperties();
        properties.setApiKey("secret_notion");
        properties.setDatabaseId("db-1");

        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        registry = new SimpleMeterRegistry();
        mirror = new NotionAuditMirror(builder.build(), properties, new TransactionMetrics(registry));
    }

    private static TransactionCompletedEvent successEvent(String receipt) {
        Transaction done = Transaction.pending(UUID.randomUUID(), "254712345678", new BigDecimal("50.00"), "ws_CO_1")
                .succeed(receipt);
        return TransactionCompletedEvent.from(done);
    }

    @Test
    @DisplayName("Completed transaction becomes a Notion page with the expected properties")
    void mirrorsPage() {
        TransactionCompletedEvent event = successEvent("R123");

        server.expect(requestTo(BASE + NotionAuditMirror.PAGES_PATH))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer secret_notion"))
                .andExpect(header("Notion-Version", "2022-06-28"))
                .andExpect(jsonPath("$.parent.database_id").value("db-1"))
                .andExpect(jsonPath("$.properties['Payment ID'].title[0].text.content")
                        .value(event.getTransactionId().toString()))
                .andExpect(jsonPath("$.properties['Phone Number'].phone_number").value("254712345678"))
                .andExpect(jsonPath("$.properties.Amount.number").value(50.0))
                .andExpect(jsonPath("$.properties['Transaction Code'].rich_text[0].text.content").value("R123"))
                .andExpect(jsonPath("$.properties.Status.select.name").value("Success"))
                .andRespond(withSuccess("{\"object\":\"page\"}", MediaType.APPLICATION_JSON));

        assertEquals(AuditMirror.MirrorResult.MIRRORED, mirror.mirror(event));
        assertEquals(1.0, registry.counter("audit.mirror", "result", "mirrored").count());
        server.verify();
    }

    @Test
    @DisplayName("Missing receipt is written as N/A")
    void missingReceipt() {
        server.expect(requestTo(BASE + NotionAuditMirror.PAGES_PATH))
                .andExpect(jsonPath("$.properties['Transaction Code'].rich_text[0].text.content")
                        .value(NotionAuditMirror.NO_SETTLEMENT_CODE))
                .andRespond(withSuccess());

        assertEquals(AuditMirror.MirrorResult.MIRRORED, mirror.mirror(successEvent(null)));
    }

    @Test
    @DisplayName("Notion failure is reported, never thrown")
    void failureIsSwallowed() {
        server.expect(requestTo(BASE + NotionAuditMirror.PAGES_PATH)).andRespond(withServerError());

        assertEquals(AuditMirror.MirrorResult.FAILED, mirror.mirror(successEvent("R1")));
        assertEquals(1.0, registry.counter("audit.mirror", "result", "failed").count());
    }

    @Test
    @DisplayName("Without credentials nothing is sent")
    void notConfigured() {
        properties.setDatabaseId("");

        assertEquals(AuditMirror.MirrorResult.NOT_CONFIGURED, mirror.mirror(successEvent("R1")));
        server.verify();
    }
}
