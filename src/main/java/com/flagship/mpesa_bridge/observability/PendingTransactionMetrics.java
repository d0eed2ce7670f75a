package com.flagship.mpesa_bridge.observability;

import com.flagship.mpesa_bridge.transaction.TransactionRepository;
import com.flagship.mpesa_bridge.transaction.TransactionStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges over transactions still waiting for a callback.
 *
 * A PENDING transaction older than {@code staleAfter} most likely lost its callback
 * (or was never correlated) and needs a manual status query.
 */
@Component
@Slf4j
public class PendingTransactionMetrics {

    private final TransactionRepository transactionRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration staleAfter;

    private final AtomicLong pending = new AtomicLong(0);
    private final AtomicLong stale = new AtomicLong(0);

    public PendingTransactionMetrics(TransactionRepository transactionRepository,
                                     MeterRegistry meterRegistry,
                                     Clock clock,
                                     @Value("${metrics.pending.stale-after:10m}") Duration staleAfter) {
        this.transactionRepository = transactionRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("transactions.pending", pending, AtomicLong::get)
                .description("STK push transactions awaiting a callback")
                .register(meterRegistry);

        Gauge.builder("transactions.pending.stale", stale, AtomicLong::get)
                .description("Pending transactions older than the stale threshold")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            pending.set(transactionRepository.countByStatus(TransactionStatus.PENDING));
            stale.set(transactionRepository.countByStatusAndCreatedAtBefore(
                    TransactionStatus.PENDING, clock.instant().minus(staleAfter)));

            if (stale.get() > 0) {
                log.info("{} pending transactions older than {} have no callback yet", stale.get(), staleAfter);
            }
        } catch (Exception e) {
            log.warn("Failed to refresh pending transaction metrics: {}", e.getMessage());
        }
    }
}
