package com.flagship.mpesa_bridge.inbound;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.mpesa_bridge.daraja.DarajaClient;
import com.flagship.mpesa_bridge.daraja.MpesaProperties;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * C2B endpoints called by Daraja, plus the admin call that registers them.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class InboundPaymentController {

    static final String VALIDATION_PATH = "/c2b/validation";
    static final String CONFIRMATION_PATH = "/c2b/confirmation";

    private final InboundPaymentHandler handler;
    private final DarajaClient darajaClient;
    private final MpesaProperties properties;

    @PostMapping(VALIDATION_PATH)
    public ResponseEntity<C2bResponse> validate(@RequestBody(required = false) C2bNotification notification) {
        return ResponseEntity.ok(handler.validate(notification));
    }

    @PostMapping(CONFIRMATION_PATH)
    public ResponseEntity<C2bResponse> confirm(@RequestBody(required = false) C2bNotification notification) {
        return ResponseEntity.ok(handler.confirm(notification));
    }

    /**
     * Registers this service's C2B URLs with Daraja. Requires the API key.
     */
    @PostMapping("/register-c2b")
    public ResponseEntity<JsonNode> registerC2bUrls() {
        MpesaProperties.C2b c2b = properties.getC2b();
        if (c2b.getConfirmationUrl() == null || c2b.getValidationUrl() == null) {
            throw new IllegalStateException("C2B confirmation and validation URLs are not configured");
        }
        return ResponseEntity.ok(darajaClient.registerC2bUrls(c2b.getConfirmationUrl(), c2b.getValidationUrl()));
    }

    /**
     * Unreadable bodies still get Daraja's answer shape: Reject on validation,
     * Failed on confirmation.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<C2bResponse> handleUnreadable(HttpMessageNotReadableException ex,
                                                        HttpServletRequest request) {
        log.warn("Unreadable C2B body on {}: {}", request.getRequestURI(), ex.getMessage());
        C2bResponse response = request.getRequestURI().endsWith(CONFIRMATION_PATH)
                ? C2bResponse.FAILED
                : C2bResponse.REJECT;
        return ResponseEntity.ok(response);
    }
}
