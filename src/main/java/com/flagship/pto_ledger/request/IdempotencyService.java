package com.flagship.pto_ledger.request;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Request idempotency keys: Redis fast path, database fallback.
 *
 * The unique constraint on {@code (company_id, employee_id, idempotency_key)} is the source of
 * truth. Redis only saves the lookup; when it is missing or down, every call goes to the database.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "pto:request-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final TimeOffRequestRepository requestRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(TimeOffRequestRepository requestRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.requestRepository = requestRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the request already created under this key, if any
     */
    public Optional<UUID> findRequestId(UUID companyId, UUID employeeId, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }
        String redisKey = redisKey(companyId, employeeId, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null && requestRepository.existsById(UUID.fromString(cached))) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = requestRepository
            .findByCompanyIdAndEmployeeIdAndIdempotencyKey(companyId, employeeId, idempotencyKey)
            .map(TimeOffRequestEntity::getId);
        stored.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(redisKey, id);
        });
        return stored;
    }

    /**
     * Caches a committed key. Best effort: the database row already guarantees uniqueness.
     */
    public void storeIdempotencyKey(UUID companyId, UUID employeeId, String idempotencyKey, UUID requestId) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return;
        }
        cache(redisKey(companyId, employeeId, idempotencyKey), requestId);
    }

    private void cache(String redisKey, UUID requestId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, requestId.toString(), REDIS_TTL);
        } catch (RuntimeException e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    private static String redisKey(UUID companyId, UUID employeeId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + companyId + ":" + employeeId + ":" + idempotencyKey;
    }
}
