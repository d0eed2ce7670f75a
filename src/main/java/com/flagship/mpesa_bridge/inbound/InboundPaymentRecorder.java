package com.flagship.mpesa_bridge.inbound;

import com.flagship.mpesa_bridge.outbox.OutboxService;
import com.flagship.mpesa_bridge.transaction.Transaction;
import com.flagship.mpesa_bridge.transaction.TransactionStore;
import com.flagship.mpesa_bridge.transaction.event.TransactionCompletedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes a confirmed C2B transaction and its completion event atomically.
 *
 * Kept apart from {@link InboundPaymentHandler} so that a failed write rolls back
 * here and the handler can still answer Daraja.
 */
@Service
@RequiredArgsConstructor
class InboundPaymentRecorder {

    private final TransactionStore transactionStore;
    private final OutboxService outboxService;

    @Transactional
    public Transaction record(Transaction transaction) {
        Transaction stored = transactionStore.create(transaction, null);
        outboxService.append(TransactionCompletedEvent.from(stored));
        return stored;
    }
}
