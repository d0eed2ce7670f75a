package com.flagship.mpesa_bridge.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges that are backed by database counts, so scrapes stay cheap.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final PendingTransactionMetrics pendingTransactionMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refreshMetrics();
        pendingTransactionMetrics.refreshMetrics();
    }
}
