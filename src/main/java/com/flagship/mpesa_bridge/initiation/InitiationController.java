package com.flagship.mpesa_bridge.initiation;

import com.flagship.mpesa_bridge.transaction.dto.InitiatePaymentRequest;
import com.flagship.mpesa_bridge.transaction.dto.InitiationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Client-facing entry point for STK push payments. Requires the API key
 * (see {@link com.flagship.mpesa_bridge.security.ApiKeyFilter}).
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class InitiationController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PushPaymentInitiator initiator;

    /**
     * Starts a payment. A 200 means the prompt was sent, not that the payer paid:
     * clients poll {@code GET /api/payments/{id}} for the outcome.
     */
    @PostMapping("/initiate")
    public ResponseEntity<InitiationResponse> initiate(
            @Valid @RequestBody InitiatePaymentRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received initiation request: amount={}, idempotencyKey={}", request.getAmount(), idempotencyKey);

        InitiationResult result = initiator.initiate(request.getPhone(), request.getAmount(), idempotencyKey);
        return toResponse(result);
    }

    static ResponseEntity<InitiationResponse> toResponse(InitiationResult result) {
        if (result.isAccepted()) {
            return ResponseEntity.ok(InitiationResponse.builder()
                    .transactionId(result.transactionId())
                    .status("initiated")
                    .message(result.message())
                    .build());
        }

        return switch (result.error()) {
            case VALIDATION -> ResponseEntity.badRequest().body(InitiationResponse.builder()
                    .status("error")
                    .error("VALIDATION")
                    .message(result.message())
                    .build());
            case UPSTREAM_REJECTED -> ResponseEntity.unprocessableEntity().body(InitiationResponse.builder()
                    .transactionId(result.transactionId())
                    .status("failed")
                    .error("UPSTREAM_REJECTED")
                    .message(result.message())
                    .build());
            case UPSTREAM_TRANSIENT -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                    InitiationResponse.builder()
                            .transactionId(result.transactionId())
                            .status("error")
                            .error("UPSTREAM_UNAVAILABLE")
                            .message(result.message())
                            .build());
            default -> throw new IllegalStateException("Unexpected initiation error: " + result.error());
        };
    }
}
