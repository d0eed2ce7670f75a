package com.flagship.mpesa_bridge.callback;

import com.flagship.mpesa_bridge.transaction.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Receives STK push results from Daraja.
 *
 * Unknown, duplicate and late callbacks are answered with 200 so Daraja does not
 * retry them. Only unverified callers (401), unparsable bodies (400) and store
 * failures (500) get a non-2xx status.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class CallbackController {

    private final CallbackCorrelator correlator;

    @PostMapping("/callback")
    public ResponseEntity<Map<String, String>> callback(
            @RequestBody(required = false) String body,
            @RequestParam(value = "key", required = false) String key) {

        CorrelationOutcome outcome = correlator.correlate(body, key);

        return switch (outcome.action()) {
            case APPLIED -> ResponseEntity.ok(status("callback processed", null));
            case IGNORED -> ResponseEntity.ok(status("ignored", outcome.reason()));
            case REJECTED -> ResponseEntity
                    .status(outcome.kind() == ErrorKind.UNVERIFIED_CALLBACK
                            ? HttpStatus.UNAUTHORIZED
                            : HttpStatus.BAD_REQUEST)
                    .body(status("error", outcome.reason()));
        };
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, String>> handleFailure(RuntimeException e) {
        log.error("STK callback processing failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(status("error", null));
    }

    private static Map<String, String> status(String status, String reason) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", status);
        if (reason != null) {
            body.put("reason", reason);
        }
        return body;
    }
}
