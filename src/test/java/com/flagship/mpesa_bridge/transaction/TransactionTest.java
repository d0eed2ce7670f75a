package com.flagship.mpesa_bridge.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TransactionTest {

    private final UUID id = UUID.randomUUID();

    @Test
    @DisplayName("New STK push transaction starts PENDING with no outcome")
    void pendingHasNoOutcome() {
        Transaction transaction = Transaction.pending(id, "254712345678", new BigDecimal("50.00"), "ws_CO_1");

        assertEquals(TransactionStatus.PENDING, transaction.getStatus());
        assertEquals(PaymentChannel.STK_PUSH, transaction.getChannel());
        assertEquals("ws_CO_1", transaction.getCorrelationToken());
        assertNull(transaction.getSettlementCode());
        assertNull(transaction.getFailureReason());
        assertFalse(transaction.isTerminal());
    }

    @Test
    @DisplayName("PENDING -> SUCCESS keeps identity and records the receipt")
    void succeedFromPending() {
        Transaction pending = Transaction.pending(id, "254712345678", new BigDecimal("50.00"), "ws_CO_1");

        Transaction done = pending.succeed("R123");

        assertEquals(TransactionStatus.SUCCESS, done.getStatus());
        assertEquals("R123", done.getSettlementCode());
        assertEquals(id, done.getId());
        assertEquals(pending.getCreatedAt(), done.getCreatedAt());
        assertEquals(pending.getPhoneNumber(), done.getPhoneNumber());
        assertEquals(0, pending.getAmount().compareTo(done.getAmount()));
        assertTrue(done.isTerminal());
    }

    @Test
    @DisplayName("PENDING -> FAILED records the reason and no settlement code")
    void failFromPending() {
        Transaction failed = Transaction.pending(id, "254712345678", BigDecimal.TEN, "ws_CO_1")
                .fail("Request cancelled by user");

        assertEquals(TransactionStatus.FAILED, failed.getStatus());
        assertEquals("Request cancelled by user", failed.getFailureReason());
        assertNull(failed.getSettlementCode());
    }

    @Test
    @DisplayName("Terminal transactions never transition again")
    void terminalIsFinal() {
        Transaction success = Transaction.pending(id, "254712345678", BigDecimal.TEN, "ws_CO_1").succeed("R1");
        Transaction failed = Transaction.pending(id, "254712345678", BigDecimal.TEN, "ws_CO_2").fail("x");

        assertThrows(IllegalStateException.class, () -> success.fail("late failure"));
        assertThrows(IllegalStateException.class, () -> success.succeed("R2"));
        assertThrows(IllegalStateException.class, () -> failed.succeed("R3"));

        for (TransactionStatus target : TransactionStatus.values()) {
            assertFalse(success.canTransitionTo(target));
            assertFalse(failed.canTransitionTo(target));
        }
    }

    @Test
    @DisplayName("C2B payment is born SUCCESS without a correlation token")
    void confirmedInbound() {
        Transaction inbound = Transaction.confirmedInbound(id, "254700000001", new BigDecimal("250.00"),
                "QK12ABC", "INV-7");

        assertEquals(TransactionStatus.SUCCESS, inbound.getStatus());
        assertEquals(PaymentChannel.C2B, inbound.getChannel());
        assertNull(inbound.getCorrelationToken());
        assertEquals("QK12ABC", inbound.getSettlementCode());
        assertEquals("INV-7", inbound.getAccountReference());
    }

    @Test
    @DisplayName("Long upstream failure descriptions are cut to the column width")
    void failureReasonTruncated() {
        String description = "x".repeat(300);

        Transaction failed = Transaction.pending(id, "254712345678", BigDecimal.TEN, "ws_CO_1").fail(description);

        assertEquals(Transaction.MAX_FAILURE_REASON_LENGTH, failed.getFailureReason().length());
        assertTrue(description.startsWith(failed.getFailureReason()));
    }

    @Test
    @DisplayName("Settlement codes wider than the column are rejected")
    void oversizedSettlementCode() {
        String receipt = "R".repeat(Transaction.MAX_SETTLEMENT_CODE_LENGTH + 1);
        Transaction pending = Transaction.pending(id, "254712345678", BigDecimal.TEN, "ws_CO_1");

        assertFalse(Transaction.isStorableSettlementCode(receipt));
        assertTrue(Transaction.isStorableSettlementCode(null));
        assertThrows(IllegalArgumentException.class, () -> pending.succeed(receipt));
        assertThrows(IllegalArgumentException.class,
                () -> Transaction.confirmedInbound(id, "254700000001", BigDecimal.TEN, receipt, "INV-7"));
    }

    @Test
    @DisplayName("C2B payer and bill reference are cut to their column widths")
    void inboundFreeTextTruncated() {
        Transaction inbound = Transaction.confirmedInbound(id, "2".repeat(100), BigDecimal.TEN,
                "QK12ABC", "B".repeat(100));

        assertEquals(Transaction.MAX_PHONE_NUMBER_LENGTH, inbound.getPhoneNumber().length());
        assertEquals(Transaction.MAX_ACCOUNT_REFERENCE_LENGTH, inbound.getAccountReference().length());
    }

    @Test
    @DisplayName("Statuses serialize as lowercase wire values")
    void wireValues() {
        assertEquals("pending", TransactionStatus.PENDING.wireValue());
        assertEquals("success", TransactionStatus.SUCCESS.wireValue());
        assertEquals("failed", TransactionStatus.FAILED.wireValue());
    }
}
