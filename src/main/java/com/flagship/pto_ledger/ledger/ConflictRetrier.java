package com.flagship.pto_ledger.ledger;

import com.flagship.pto_ledger.exception.ConcurrencyConflictException;
import com.flagship.pto_ledger.observability.PtoMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Re-runs a unit of work that lost a lock race, a bounded number of times.
 *
 * The work must open its own transaction (call a {@code @Transactional} service from outside),
 * so every attempt starts from a clean, rolled-back state.
 */
@Component
@Slf4j
public class ConflictRetrier {

    private final int maxAttempts;
    private final PtoMetrics metrics;

    public ConflictRetrier(@Value("${pto.concurrency.max-attempts:3}") int maxAttempts, PtoMetrics metrics) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.metrics = metrics;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        int attempt = 1;
        while (true) {
            try {
                return work.get();
            } catch (ConcurrencyConflictException | PessimisticLockingFailureException e) {
                metrics.recordLockConflict(operation);
                if (attempt >= maxAttempts) {
                    log.warn("Giving up after {} attempts: operation={}, error={}", attempt, operation, e.getMessage());
                    if (e instanceof ConcurrencyConflictException conflict) {
                        throw conflict;
                    }
                    throw new ConcurrencyConflictException("Concurrent update on " + operation, e);
                }
                log.info("Concurrency conflict, retrying: operation={}, attempt={}/{}", operation, attempt, maxAttempts);
                attempt++;
            }
        }
    }
}
