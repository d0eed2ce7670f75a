package com.flagship.mpesa_bridge.initiation;

import com.flagship.mpesa_bridge.daraja.DarajaClient;
import com.flagship.mpesa_bridge.daraja.MpesaProperties;
import com.flagship.mpesa_bridge.daraja.StkPushAcceptance;
import com.flagship.mpesa_bridge.daraja.StkPushRequest;
import com.flagship.mpesa_bridge.daraja.UpstreamRejectionException;
import com.flagship.mpesa_bridge.daraja.UpstreamTransientException;
import com.flagship.mpesa_bridge.observability.TraceContext;
import com.flagship.mpesa_bridge.observability.TransactionMetrics;
import com.flagship.mpesa_bridge.transaction.IdempotencyService;
import com.flagship.mpesa_bridge.transaction.Transaction;
import com.flagship.mpesa_bridge.transaction.TransactionStatus;
import com.flagship.mpesa_bridge.transaction.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Starts Lipa na M-Pesa Online (STK push) payments.
 *
 * Every valid request reserves its transaction (PENDING, no token, idempotency key
 * attached) before anything reaches Daraja, so a second request with the same key
 * collides on the insert and replays instead of pushing again. The reserved row
 * then settles according to Daraja's answer:
 * - accepted: stays PENDING with the CheckoutRequestID attached as correlation token
 * - rejected: FAILED
 * - token fetch failed: FAILED, nothing reached Daraja
 * - push submission failed: PENDING without token, Daraja may or may not have sent it
 *
 * The network calls run outside any database transaction.
 */
@Service
@Slf4j
public class PushPaymentInitiator {

    static final Pattern PHONE_PATTERN = Pattern.compile("^254[0-9]{9}$");
    private static final int ACCOUNT_REFERENCE_LENGTH = 12;
    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

    private final DarajaClient darajaClient;
    private final TransactionStore transactionStore;
    private final IdempotencyService idempotencyService;
    private final MpesaProperties properties;
    private final TransactionMetrics metrics;

    public PushPaymentInitiator(DarajaClient darajaClient,
                                TransactionStore transactionStore,
                                IdempotencyService idempotencyService,
                                MpesaProperties properties,
                                TransactionMetrics metrics) {
        this.darajaClient = darajaClient;
        this.transactionStore = transactionStore;
        this.idempotencyService = idempotencyService;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Validates the request and, if valid, pushes a payment prompt to the payer.
     *
     * @param idempotencyKey optional; a repeated key returns the original result
     */
    public InitiationResult initiate(String phoneNumber, BigDecimal amount, String idempotencyKey) {
        Optional<String> violation = validate(phoneNumber, amount);
        if (violation.isPresent()) {
            log.info("Rejected initiation before any network call: {}", violation.get());
            metrics.recordInitiation("invalid");
            return InitiationResult.invalid(violation.get());
        }

        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();
        if (keyed && idempotencyKey.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            metrics.recordInitiation("invalid");
            return InitiationResult.invalid(
                    "Idempotency-Key must be at most " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        if (keyed) {
            Optional<UUID> existing = idempotencyService.findTransactionId(idempotencyKey);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                return replay(existing.get());
            }
            metrics.recordIdempotencyMiss();
        }

        BigDecimal normalized = amount.setScale(2, RoundingMode.HALF_UP);
        String key = keyed ? idempotencyKey : null;

        Transaction reserved;
        try {
            reserved = reserve(phoneNumber, normalized, key);
        } catch (DataIntegrityViolationException e) {
            Optional<Transaction> winner = key == null ? Optional.empty() : transactionStore.findByIdempotencyKey(key);
            if (winner.isEmpty()) {
                throw e;
            }
            log.info("Idempotency key claimed by a concurrent request, returning transaction {}",
                    winner.get().getId());
            metrics.recordIdempotencyHit();
            return replay(winner.get().getId());
        }

        MDC.put(TraceContext.TRANSACTION_ID_MDC_KEY, reserved.getId().toString());
        try {
            InitiationResult result = push(reserved);
            metrics.recordInitiation(result.isAccepted() ? "accepted" : result.error().name());
            return result;
        } finally {
            MDC.remove(TraceContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Checks phone format and amount bounds.
     *
     * @return a human-readable violation, or empty if the input is valid
     */
    Optional<String> validate(String phoneNumber, BigDecimal amount) {
        if (phoneNumber == null || !PHONE_PATTERN.matcher(phoneNumber).matches()) {
            return Optional.of("Phone number must be in format 254XXXXXXXXX");
        }
        if (amount == null) {
            return Optional.of("Amount is required");
        }
        BigDecimal min = properties.getLimits().getMinAmount();
        BigDecimal max = properties.getLimits().getMaxAmount();
        if (amount.compareTo(min) < 0 || amount.compareTo(max) > 0) {
            return Optional.of("Amount must be between " + min.toPlainString() + " and " + max.toPlainString());
        }
        return Optional.empty();
    }

    /**
     * Inserts the PENDING row that every later outcome settles.
     *
     * @throws DataIntegrityViolationException if the idempotency key is already taken
     */
    private Transaction reserve(String phoneNumber, BigDecimal amount, String idempotencyKey) {
        Transaction reserved = transactionStore.create(
                Transaction.pending(UUID.randomUUID(), phoneNumber, amount, null), idempotencyKey);
        if (idempotencyKey != null) {
            idempotencyService.remember(idempotencyKey, reserved.getId());
        }
        return reserved;
    }

    private InitiationResult push(Transaction reserved) {
        UUID transactionId = reserved.getId();

        String accessToken;
        try {
            accessToken = darajaClient.fetchAccessToken();
        } catch (UpstreamTransientException e) {
            log.warn("Access token unavailable, recording transaction as failed: {}", e.getMessage());
            transactionStore.failIfPending(reserved.fail("Upstream authentication unavailable"));
            return InitiationResult.unavailable(transactionId, TransactionStatus.FAILED,
                    "Payment service temporarily unavailable");
        }

        String reference = accountReference(transactionId);
        StkPushRequest request = new StkPushRequest(
                reserved.getPhoneNumber(), reserved.getAmount(), reference,
                "Payment for order " + reference, callbackUrl());

        StkPushAcceptance acceptance;
        try {
            acceptance = darajaClient.requestStkPush(request, accessToken);
        } catch (UpstreamRejectionException e) {
            log.info("STK push rejected: errorCode={}, message={}", e.getErrorCode(), e.getMessage());
            transactionStore.failIfPending(reserved.fail(e.getMessage()));
            return InitiationResult.rejected(transactionId, e.getMessage());
        } catch (UpstreamTransientException e) {
            log.warn("STK push outcome unknown, leaving transaction pending: {}", e.getMessage());
            return InitiationResult.unavailable(transactionId, TransactionStatus.PENDING,
                    "Payment request could not be confirmed; check the status before retrying");
        }

        attachToken(transactionId, acceptance.checkoutRequestId());
        log.info("STK push accepted: checkoutRequestId={}, amount={}",
                acceptance.checkoutRequestId(), reserved.getAmount());

        String message = acceptance.customerMessage() != null
                ? acceptance.customerMessage()
                : "STK push sent to your phone";
        return InitiationResult.accepted(transactionId, message);
    }

    /**
     * The push already went out, so a token that cannot be stored leaves the row
     * PENDING and uncorrelatable rather than failing the request.
     */
    private void attachToken(UUID transactionId, String checkoutRequestId) {
        if (checkoutRequestId == null) {
            log.warn("Daraja accepted the push without a CheckoutRequestID; transaction can never be correlated");
            return;
        }
        try {
            if (!transactionStore.attachCorrelationToken(transactionId, checkoutRequestId)) {
                log.warn("Could not attach checkoutRequestId={}: transaction no longer pending", checkoutRequestId);
            }
        } catch (DataIntegrityViolationException e) {
            log.error("checkoutRequestId={} already belongs to another transaction", checkoutRequestId, e);
        }
    }

    private InitiationResult replay(UUID transactionId) {
        Transaction existing = transactionStore.findById(transactionId)
                .orElseThrow(() -> new IllegalStateException(
                        "Idempotency key maps to missing transaction " + transactionId));

        log.info("Idempotency key already used, returning transaction {}", transactionId);

        if (existing.getStatus() == TransactionStatus.FAILED) {
            return InitiationResult.rejected(transactionId, existing.getFailureReason());
        }
        return InitiationResult.accepted(transactionId, "Payment already initiated");
    }

    /**
     * Daraja caps AccountReference at 12 characters.
     */
    static String accountReference(UUID transactionId) {
        return transactionId.toString().replace("-", "").substring(0, ACCOUNT_REFERENCE_LENGTH).toUpperCase();
    }

    private String callbackUrl() {
        String secret = properties.getCallback().getSecret();
        if (secret == null || secret.isBlank()) {
            return properties.getCallback().getUrl();
        }
        return UriComponentsBuilder.fromUriString(properties.getCallback().getUrl())
                .queryParam("key", secret)
                .encode()
                .toUriString();
    }
}
