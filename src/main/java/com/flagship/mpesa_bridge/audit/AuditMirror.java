package com.flagship.mpesa_bridge.audit;

import com.flagship.mpesa_bridge.transaction.event.TransactionCompletedEvent;

/**
 * Best-effort copy of completed transactions to an external record.
 * Implementations report failures through the result and never throw.
 */
public interface AuditMirror {

    MirrorResult mirror(TransactionCompletedEvent event);

    enum MirrorResult {
        MIRRORED,
        NOT_CONFIGURED,
        FAILED
    }
}
