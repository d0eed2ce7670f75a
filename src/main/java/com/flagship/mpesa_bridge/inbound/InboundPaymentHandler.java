package com.flagship.mpesa_bridge.inbound;

import com.flagship.mpesa_bridge.observability.TraceContext;
import com.flagship.mpesa_bridge.observability.TransactionMetrics;
import com.flagship.mpesa_bridge.transaction.Transaction;
import com.flagship.mpesa_bridge.transaction.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.UUID;

/**
 * Handles customer-initiated (C2B) payments.
 *
 * Validation delegates to the configured {@link InboundValidationPolicy}; a policy
 * that throws counts as a rejection. Confirmation records the payment as SUCCESS,
 * once per TransID: the database refuses a second C2B row with the same receipt,
 * and a redelivery that loses that race is answered like any other duplicate.
 * Neither operation lets an exception escape: Daraja only understands its own
 * two-field answer.
 */
@Service
@Slf4j
public class InboundPaymentHandler {

    static final String UNKNOWN_PAYER = "unknown";

    private final InboundValidationPolicy validationPolicy;
    private final InboundPaymentRecorder recorder;
    private final TransactionStore transactionStore;
    private final TransactionMetrics metrics;

    public InboundPaymentHandler(InboundValidationPolicy validationPolicy,
                                 InboundPaymentRecorder recorder,
                                 TransactionStore transactionStore,
                                 TransactionMetrics metrics) {
        this.validationPolicy = validationPolicy;
        this.recorder = recorder;
        this.transactionStore = transactionStore;
        this.metrics = metrics;
    }

    public C2bResponse validate(C2bNotification notification) {
        C2bResponse response;
        try {
            response = notification != null && validationPolicy.accept(notification)
                    ? C2bResponse.ACCEPT
                    : C2bResponse.REJECT;
        } catch (RuntimeException e) {
            log.warn("Validation policy failed for C2B payment {}, rejecting: {}",
                    notification.transId(), e.getMessage());
            response = C2bResponse.REJECT;
        }

        log.info("C2B validation {}: transId={}, amount={}, billRef={}",
                response.resultDesc(),
                notification != null ? notification.transId() : null,
                notification != null ? notification.transAmount() : null,
                notification != null ? notification.billRefNumber() : null);
        metrics.recordInbound("validation", response.resultDesc());
        return response;
    }

    public C2bResponse confirm(C2bNotification notification) {
        C2bResponse response;
        try {
            response = record(notification);
        } catch (RuntimeException e) {
            log.error("Failed to record C2B confirmation {}: {}",
                    notification != null ? notification.transId() : null, e.getMessage(), e);
            response = C2bResponse.FAILED;
        }
        metrics.recordInbound("confirmation", response.resultDesc());
        return response;
    }

    private C2bResponse record(C2bNotification notification) {
        if (notification == null || isBlank(notification.transId())) {
            log.warn("C2B confirmation without TransID");
            return C2bResponse.FAILED;
        }

        if (!Transaction.isStorableSettlementCode(notification.transId())) {
            log.warn("C2B confirmation TransID is {} characters, longer than any M-Pesa receipt",
                    notification.transId().length());
            return C2bResponse.FAILED;
        }

        Optional<BigDecimal> amount = parseAmount(notification.transAmount());
        if (amount.isEmpty()) {
            log.warn("C2B confirmation {} has unusable amount '{}'",
                    notification.transId(), notification.transAmount());
            return C2bResponse.FAILED;
        }

        Optional<Transaction> existing = transactionStore.findSuccessfulBySettlementCode(notification.transId());
        if (existing.isPresent()) {
            log.info("C2B confirmation {} already recorded as transaction {}",
                    notification.transId(), existing.get().getId());
            return C2bResponse.SUCCESS;
        }

        UUID transactionId = UUID.randomUUID();
        MDC.put(TraceContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());
        try {
            String payer = isBlank(notification.msisdn()) ? UNKNOWN_PAYER : notification.msisdn();
            Transaction stored;
            try {
                stored = recorder.record(Transaction.confirmedInbound(
                        transactionId, payer, amount.get(), notification.transId(), notification.billRefNumber()));
            } catch (DataIntegrityViolationException e) {
                Transaction winner = transactionStore.findSuccessfulBySettlementCode(notification.transId())
                        .orElseThrow(() -> e);
                log.info("Concurrent C2B confirmation {} already recorded as transaction {}",
                        notification.transId(), winner.getId());
                return C2bResponse.SUCCESS;
            }

            log.info("C2B payment recorded: transId={}, amount={}, billRef={}",
                    stored.getSettlementCode(), stored.getAmount(), stored.getAccountReference());
            return C2bResponse.SUCCESS;
        } finally {
            MDC.remove(TraceContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    static Optional<BigDecimal> parseAmount(String raw) {
        if (isBlank(raw)) {
            return Optional.empty();
        }
        try {
            BigDecimal amount = new BigDecimal(raw.trim());
            if (amount.signum() <= 0) {
                return Optional.empty();
            }
            return Optional.of(amount.setScale(2, RoundingMode.HALF_UP));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
