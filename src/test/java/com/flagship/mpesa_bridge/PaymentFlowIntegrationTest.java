package com.flagship.mpesa_bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.mpesa_bridge.daraja.DarajaClient;
import com.flagship.mpesa_bridge.daraja.StkPushAcceptance;
import com.flagship.mpesa_bridge.daraja.StkPushRequest;
import com.flagship.mpesa_bridge.daraja.UpstreamRejectionException;
import com.flagship.mpesa_bridge.outbox.OutboxEventRepository;
import com.flagship.mpesa_bridge.transaction.TransactionRepository;
import com.flagship.mpesa_bridge.transaction.TransactionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end HTTP flows against PostgreSQL with Daraja stubbed out.
 */
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class PaymentFlowIntegrationTest extends AbstractIntegrationTest {

    private static final String PHONE = "254712345678";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @MockBean
    private DarajaClient darajaClient;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
        transactionRepository.deleteAll();
        when(darajaClient.fetchAccessToken()).thenReturn("token");
    }

    private UUID initiate(String idempotencyKey) throws Exception {
        var request = post("/api/payments/initiate")
                .header("Authorization", "Bearer " + API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"phone\":\"" + PHONE + "\",\"amount\":50}");
        if (idempotencyKey != null) {
            request.header("Idempotency-Key", idempotencyKey);
        }
        MvcResult result = mockMvc.perform(request)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("initiated"))
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.path("transaction_id").asText());
    }

    private static String callback(String token, String receipt) {
        return """
                {"Body":{"stkCallback":{"MerchantRequestID":"m-1","CheckoutRequestID":"%s",
                "ResultCode":0,"ResultDesc":"The service request is processed successfully.",
                "CallbackMetadata":{"Item":[{"Name":"Amount","Value":50},
                {"Name":"MpesaReceiptNumber","Value":"%s"},{"Name":"PhoneNumber","Value":254712345678}]}}}}"""
                .formatted(token, receipt);
    }

    @Test
    @DisplayName("STK push: initiate, poll pending, callback, poll success")
    void stkPushLifecycle() throws Exception {
        printTestHeader("STK push lifecycle");

        when(darajaClient.requestStkPush(any(StkPushRequest.class), anyString()))
                .thenReturn(new StkPushAcceptance("ws_CO_flow", "m-1", "Success. Request accepted for processing",
                        "Success. Request accepted for processing"));

        UUID id = initiate(null);
        printOutput("Transaction", id);

        mockMvc.perform(get("/api/payments/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.settlement_code").doesNotExist());

        mockMvc.perform(post("/api/payments/callback").param("key", CALLBACK_SECRET)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(callback("ws_CO_flow", "R123")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("callback processed"));

        mockMvc.perform(get("/api/payments/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.settlement_code").value("R123"));

        mockMvc.perform(post("/api/payments/callback").param("key", CALLBACK_SECRET)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(callback("ws_CO_flow", "R999")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ignored"));

        mockMvc.perform(get("/api/payments/{id}", id))
                .andExpect(jsonPath("$.settlement_code").value("R123"));
        assertEquals(1, outboxEventRepository.findByAggregateIdOrderBySequenceNumberAsc(id).size());

        printSuccess("Lifecycle complete, duplicate callback ignored");
    }

    @Test
    @DisplayName("Callback with a wrong key is refused and changes nothing")
    void unverifiedCallback() throws Exception {
        when(darajaClient.requestStkPush(any(StkPushRequest.class), anyString()))
                .thenReturn(new StkPushAcceptance("ws_CO_key", "m-1", "ok", null));
        UUID id = initiate(null);

        mockMvc.perform(post("/api/payments/callback").param("key", "wrong")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(callback("ws_CO_key", "R1")))
                .andExpect(status().isUnauthorized());

        assertEquals(TransactionStatus.PENDING, transactionRepository.findById(id).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Repeated idempotency key returns the original transaction without a second push")
    void idempotentInitiation() throws Exception {
        printTestHeader("Idempotent initiation");

        when(darajaClient.requestStkPush(any(StkPushRequest.class), anyString()))
                .thenReturn(new StkPushAcceptance("ws_CO_idem", "m-1", "ok", null));

        UUID first = initiate("order-42");
        UUID second = initiate("order-42");

        assertEquals(first, second);
        assertEquals(1, transactionRepository.count());
        verify(darajaClient, times(1)).requestStkPush(any(StkPushRequest.class), anyString());

        printSuccess("Single transaction for one key");
    }

    @Test
    @DisplayName("Rejected push is stored as failed and reported as 422")
    void rejectedPush() throws Exception {
        when(darajaClient.requestStkPush(any(StkPushRequest.class), anyString()))
                .thenThrow(new UpstreamRejectionException("400.002.02", "Bad Request - Invalid PhoneNumber"));

        MvcResult result = mockMvc.perform(post("/api/payments/initiate")
                        .header("Authorization", "Bearer " + API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone\":\"" + PHONE + "\",\"amount\":50}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value("failed"))
                .andReturn();

        UUID id = UUID.fromString(objectMapper.readTree(result.getResponse().getContentAsString())
                .path("transaction_id").asText());

        mockMvc.perform(get("/api/payments/{id}", id))
                .andExpect(jsonPath("$.status").value("failed"));
    }

    @Test
    @DisplayName("Initiation without the API key is refused before any upstream call")
    void initiationRequiresApiKey() throws Exception {
        mockMvc.perform(post("/api/payments/initiate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone\":\"" + PHONE + "\",\"amount\":50}"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/payments/initiate;x=1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone\":\"" + PHONE + "\",\"amount\":50}"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(darajaClient);
        assertEquals(0, transactionRepository.count());
    }

    @Test
    @DisplayName("C2B confirmation is recorded once even when Daraja redelivers it")
    void c2bConfirmationRecordedOnce() throws Exception {
        printTestHeader("C2B confirmation redelivery");

        String confirmation = """
                {"TransactionType":"Pay Bill","TransID":"QK12ABC","TransTime":"20240115123005",
                "TransAmount":"250.00","BusinessShortCode":"174379","BillRefNumber":"INV-7",
                "OrgAccountBalance":"","MSISDN":"254700000001","FirstName":"JANE"}""";

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/api/payments/c2b/confirmation")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(confirmation))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ResultCode").value(0))
                    .andExpect(jsonPath("$.ResultDesc").value("Success"));
        }

        long recorded = transactionRepository.findAll().stream()
                .filter(t -> "QK12ABC".equals(t.getSettlementCode()))
                .count();
        assertEquals(1, recorded);

        mockMvc.perform(get("/api/payments/history").header("Authorization", "Bearer " + API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].status").value("success"));

        printSuccess("One row for one receipt");
    }

    @Test
    @DisplayName("C2B validation accepts by default")
    void c2bValidation() throws Exception {
        mockMvc.perform(post("/api/payments/c2b/validation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"TransID\":\"QK12ABC\",\"TransAmount\":\"250.00\",\"MSISDN\":\"254700000001\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ResultCode").value(0))
                .andExpect(jsonPath("$.ResultDesc").value("Accept"));

        assertEquals(0, transactionRepository.count());
    }

    @Test
    @DisplayName("Unknown transaction id answers 404 not_found")
    void unknownTransaction() throws Exception {
        mockMvc.perform(get("/api/payments/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("not_found"));
    }
}
