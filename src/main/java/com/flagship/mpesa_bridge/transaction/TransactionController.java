package com.flagship.mpesa_bridge.transaction;

import com.flagship.mpesa_bridge.daraja.DarajaClient;
import com.flagship.mpesa_bridge.daraja.StkQueryResult;
import com.flagship.mpesa_bridge.transaction.dto.TransactionStatusResponse;
import com.flagship.mpesa_bridge.transaction.dto.TransactionSummary;
import com.flagship.mpesa_bridge.transaction.dto.UpstreamStatusResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side of the transaction store.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    static final int DEFAULT_HISTORY_LIMIT = 50;
    static final int MAX_HISTORY_LIMIT = 200;

    private static final Map<String, String> NOT_FOUND = Map.of("status", "not_found");

    private final TransactionStore transactionStore;
    private final DarajaClient darajaClient;

    /**
     * Current status of a transaction. A malformed id is simply not found.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> getStatus(@PathVariable("id") String id) {
        Optional<Transaction> transaction = parseId(id).flatMap(transactionStore::findById);
        if (transaction.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(NOT_FOUND);
        }
        return ResponseEntity.ok(TransactionStatusResponse.from(transaction.get()));
    }

    /**
     * Most recent transactions first. Requires the API key.
     */
    @GetMapping("/history")
    public ResponseEntity<List<TransactionSummary>> history(
            @RequestParam(value = "limit", defaultValue = "" + DEFAULT_HISTORY_LIMIT) int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        List<TransactionSummary> rows = transactionStore.findRecent(limit, offset).stream()
            .map(TransactionSummary::from)
            .toList();
        return ResponseEntity.ok(rows);
    }

    /**
     * Asks Daraja what it knows about an STK push. Never changes the stored
     * transaction. Requires the API key.
     */
    @GetMapping("/{id}/upstream-status")
    public ResponseEntity<?> upstreamStatus(@PathVariable("id") String id) {
        Optional<Transaction> found = parseId(id).flatMap(transactionStore::findById);
        if (found.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(NOT_FOUND);
        }
        Transaction transaction = found.get();
        if (transaction.getCorrelationToken() == null) {
            throw new IllegalStateException("Transaction " + transaction.getId() + " has no CheckoutRequestID to query");
        }

        StkQueryResult result = darajaClient.queryStkStatus(transaction.getCorrelationToken());
        log.info("Upstream status for {}: local={}, resultCode={}, resultDesc={}",
                transaction.getId(), transaction.getStatus(), result.resultCode(), result.resultDesc());
        return ResponseEntity.ok(UpstreamStatusResponse.of(transaction.getId(), transaction.getStatus(), result));
    }

    private static Optional<UUID> parseId(String id) {
        try {
            return Optional.of(UUID.fromString(id));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
