package com.flagship.pto_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - pto.requests.transitions: request transitions by transition and outcome
 * - pto.accruals: accrual outcomes by source (time, payroll) and outcome
 * - pto.year_end: carryover and expiration outcomes
 * - pto.ledger.replays: postings absorbed by the idempotency key
 * - pto.balance.refusals: writes refused by the balance invariant
 * - pto.lock.conflicts: lock timeouts and stale snapshot versions
 * - pto.latency: operation latency
 * - pto.requests.pending: submitted requests awaiting a decision (refreshed by {@link MetricsScheduler})
 */
@Component
public class PtoMetrics {

    private final MeterRegistry registry;
    private final Counter idempotencyHits;
    private final Counter idempotencyMisses;
    private final AtomicLong pendingRequests = new AtomicLong(0);

    public PtoMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.idempotencyHits = Counter.builder("pto.requests.idempotency")
                .description("Request submissions answered from an existing idempotency key")
                .tag("result", "hit")
                .register(registry);
        this.idempotencyMisses = Counter.builder("pto.requests.idempotency")
                .description("Request submissions answered from an existing idempotency key")
                .tag("result", "miss")
                .register(registry);
        Gauge.builder("pto.requests.pending", pendingRequests, AtomicLong::get)
                .description("Submitted requests holding balance while awaiting a decision")
                .register(registry);
    }

    public void updatePendingRequests(long count) {
        pendingRequests.set(count);
    }

    public void recordRequestTransition(String transition, String outcome) {
        registry.counter("pto.requests.transitions",
                "transition", sanitizeTag(transition),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordAccrual(String source, String outcome) {
        registry.counter("pto.accruals",
                "source", sanitizeTag(source),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordYearEnd(String kind, String outcome) {
        registry.counter("pto.year_end",
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLedgerReplay(String entryType) {
        registry.counter("pto.ledger.replays", "entry_type", sanitizeTag(entryType)).increment();
    }

    public void recordBalanceRefusal(String entryType) {
        registry.counter("pto.balance.refusals", "entry_type", sanitizeTag(entryType)).increment();
    }

    public void recordLockConflict(String operation) {
        registry.counter("pto.lock.conflicts", "operation", sanitizeTag(operation)).increment();
    }

    public void recordIdempotencyHit() {
        idempotencyHits.increment();
    }

    public void recordIdempotencyMiss() {
        idempotencyMisses.increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("pto.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
