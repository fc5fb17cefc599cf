package com.flagship.pto_ledger.observability;

import com.flagship.pto_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Readiness signals beyond the datasource: outbox backlog and the optional Redis fast path.
 */
public class HealthIndicators {

    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD ? Health.status("WARNING") : Health.down();
                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (RuntimeException e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the request idempotency fast path, so an outage degrades rather than fails.
     */
    @Component("idempotencyCacheHealth")
    public static class IdempotencyCacheHealthIndicator implements HealthIndicator {

        private final ObjectProvider<RedisConnectionFactory> connectionFactory;

        public IdempotencyCacheHealthIndicator(ObjectProvider<RedisConnectionFactory> connectionFactory) {
            this.connectionFactory = connectionFactory;
        }

        @Override
        public Health health() {
            RedisConnectionFactory factory = connectionFactory.getIfAvailable();
            if (factory == null) {
                return Health.up().withDetail("mode", "database-only").build();
            }
            try (RedisConnection connection = factory.getConnection()) {
                String pong = connection.ping();
                return "PONG".equals(pong)
                        ? Health.up().withDetail("response", pong).build()
                        : Health.status("DEGRADED").withDetail("response", String.valueOf(pong)).build();
            } catch (RuntimeException e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", "Idempotency keys fall back to the database")
                        .build();
            }
        }
    }
}
