package com.flagship.mpesa_bridge.inbound;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.mpesa_bridge.daraja.DarajaClient;
import com.flagship.mpesa_bridge.daraja.MpesaProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = InboundPaymentController.class, properties = "security.api-key=test-key")
class InboundPaymentControllerTest {

    private static final String CONFIRMATION = """
            {"TransactionType":"Pay Bill","TransID":"QK12ABC","TransTime":"20240115123005",
             "TransAmount":"250.00","BusinessShortCode":"600000","BillRefNumber":"INV-7",
             "InvoiceNumber":"","OrgAccountBalance":"1000.00","ThirdPartyTransID":"",
             "MSISDN":"254700000001","FirstName":"Jane","MiddleName":"","LastName":"Doe",
             "SomethingNew":"ignored"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InboundPaymentHandler handler;

    @MockBean
    private DarajaClient darajaClient;

    @MockBean
    private MpesaProperties properties;

    @Test
    @DisplayName("Validation relays the handler's decision in Daraja's shape")
    void validation() throws Exception {
        when(handler.validate(any())).thenReturn(C2bResponse.REJECT);

        mockMvc.perform(post("/api/payments/c2b/validation")
                        .contentType(MediaType.APPLICATION_JSON).content(CONFIRMATION))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ResultCode").value(1))
                .andExpect(jsonPath("$.ResultDesc").value("Reject"));
    }

    @Test
    @DisplayName("Confirmation fields are bound from Daraja's names")
    void confirmation() throws Exception {
        when(handler.confirm(any())).thenReturn(C2bResponse.SUCCESS);

        mockMvc.perform(post("/api/payments/c2b/confirmation")
                        .contentType(MediaType.APPLICATION_JSON).content(CONFIRMATION))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ResultCode").value(0))
                .andExpect(jsonPath("$.ResultDesc").value("Success"));

        verify(handler).confirm(argThat(n -> "QK12ABC".equals(n.transId())
                && "250.00".equals(n.transAmount())
                && "INV-7".equals(n.billRefNumber())
                && "254700000001".equals(n.msisdn())));
    }

    @Test
    @DisplayName("Unreadable bodies still get 200 with Reject or Failed")
    void unreadableBodies() throws Exception {
        mockMvc.perform(post("/api/payments/c2b/validation")
                        .contentType(MediaType.APPLICATION_JSON).content("{broken"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ResultDesc").value("Reject"));

        mockMvc.perform(post("/api/payments/c2b/confirmation")
                        .contentType(MediaType.APPLICATION_JSON).content("{broken"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ResultDesc").value("Failed"));

        verifyNoInteractions(handler);
    }

    @Test
    @DisplayName("URL registration uses the configured C2B URLs and requires the API key")
    void registersUrls() throws Exception {
        MpesaProperties.C2b c2b = new MpesaProperties.C2b();
        c2b.setConfirmationUrl("https://bridge.example.com/api/payments/c2b/confirmation");
        c2b.setValidationUrl("https://bridge.example.com/api/payments/c2b/validation");
        when(properties.getC2b()).thenReturn(c2b);
        when(darajaClient.registerC2bUrls(c2b.getConfirmationUrl(), c2b.getValidationUrl()))
                .thenReturn(new ObjectMapper().readTree("{\"ResponseDescription\":\"success\"}"));

        mockMvc.perform(post("/api/payments/register-c2b"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/payments/register-c2b").header("Authorization", "Bearer test-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ResponseDescription").value("success"));
    }
}
