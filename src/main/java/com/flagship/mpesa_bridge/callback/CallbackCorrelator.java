package com.flagship.mpesa_bridge.callback;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.mpesa_bridge.observability.TraceContext;
import com.flagship.mpesa_bridge.observability.TransactionMetrics;
import com.flagship.mpesa_bridge.outbox.OutboxService;
import com.flagship.mpesa_bridge.transaction.Transaction;
import com.flagship.mpesa_bridge.transaction.TransactionStore;
import com.flagship.mpesa_bridge.transaction.event.TransactionCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Matches STK callbacks to pending transactions and applies the terminal transition.
 *
 * Terminal transactions are never overwritten: a late or duplicate callback is
 * ignored and logged. The transition is a status-conditioned update, so when the
 * same callback arrives twice concurrently exactly one delivery is APPLIED and
 * only that one writes the completion event for the audit mirror.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CallbackCorrelator {

    private final CallbackVerifier verifier;
    private final ObjectMapper objectMapper;
    private final TransactionStore transactionStore;
    private final OutboxService outboxService;
    private final TransactionMetrics metrics;

    /**
     * @param rawBody        the callback body exactly as received
     * @param presentedSecret value of the callback URL's key parameter, may be null
     */
    @Transactional
    public CorrelationOutcome correlate(String rawBody, String presentedSecret) {
        CorrelationOutcome outcome = handle(rawBody, presentedSecret);
        metrics.recordCallback(outcome.action().name());
        return outcome;
    }

    private CorrelationOutcome handle(String rawBody, String presentedSecret) {
        if (!verifier.verify(presentedSecret)) {
            log.warn("Rejected STK callback with missing or invalid key");
            return CorrelationOutcome.unverified();
        }

        Optional<StkCallback> parsed = parse(rawBody);
        if (parsed.isEmpty()) {
            return CorrelationOutcome.malformed("body is not a JSON object");
        }

        StkCallback callback = parsed.get();

        if (!callback.hasCorrelationToken()) {
            log.info("STK callback without CheckoutRequestID ignored");
            return CorrelationOutcome.ignored("missing correlation token");
        }

        String token = callback.checkoutRequestId();
        Optional<Transaction> existing = transactionStore.findByCorrelationToken(token);
        if (existing.isEmpty()) {
            log.info("STK callback for unknown CheckoutRequestID {} ignored", token);
            return CorrelationOutcome.ignored("unknown correlation token");
        }

        Transaction transaction = existing.get();
        MDC.put(TraceContext.TRANSACTION_ID_MDC_KEY, transaction.getId().toString());
        try {
            if (transaction.isTerminal()) {
                log.info("STK callback for already {} transaction ignored: resultCode={}",
                        transaction.getStatus(), callback.resultCode());
                return CorrelationOutcome.ignored("already terminal");
            }
            return apply(transaction, callback);
        } finally {
            MDC.remove(TraceContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private CorrelationOutcome apply(Transaction transaction, StkCallback callback) {
        Transaction target = callback.isSuccess()
                ? transaction.succeed(storableReceipt(callback))
                : transaction.fail(failureReason(callback));

        Optional<Transaction> completed = transactionStore.completeIfPending(target);
        if (completed.isEmpty()) {
            log.info("Concurrent STK callback already completed transaction {}", transaction.getId());
            return CorrelationOutcome.ignored("already terminal");
        }

        Transaction updated = completed.get();
        outboxService.append(TransactionCompletedEvent.from(updated));

        log.info("Transaction {} -> {} (receipt={}, resultCode={})",
                updated.getId(), updated.getStatus(), updated.getSettlementCode(), callback.resultCode());
        return CorrelationOutcome.applied(updated);
    }

    /**
     * M-Pesa receipts are ten characters. Anything too long for the column is logged
     * and dropped so the payment itself is still recorded.
     */
    private static String storableReceipt(StkCallback callback) {
        String receipt = callback.receiptNumber();
        if (Transaction.isStorableSettlementCode(receipt)) {
            return receipt;
        }
        log.warn("Dropping oversized MpesaReceiptNumber for {}: {}", callback.checkoutRequestId(), receipt);
        return null;
    }

    private Optional<StkCallback> parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            log.warn("Empty STK callback body");
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(rawBody);
            if (root == null || !root.isObject()) {
                log.warn("STK callback body is not a JSON object");
                return Optional.empty();
            }
            return Optional.of(StkCallback.from(root));
        } catch (JsonProcessingException e) {
            log.warn("Malformed STK callback body: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String failureReason(StkCallback callback) {
        if (callback.resultDesc() != null) {
            return callback.resultDesc();
        }
        return callback.resultCode() != null
                ? "Result code " + callback.resultCode()
                : "Unparsable result code";
    }
}
