package com.flagship.pto_ledger.policy;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Policy header. Its rules live in {@link PolicyVersion}s.
 */
@Value
public class TimeOffPolicy {
    UUID id;
    UUID companyId;
    String key;
    String name;
    PolicyCategory category;
    UUID createdBy;
    Instant createdAt;

    public static TimeOffPolicy create(UUID companyId, String key, String name,
                                       PolicyCategory category, UUID createdBy, Instant createdAt) {
        return new TimeOffPolicy(UUID.randomUUID(), companyId, key, name, category, createdBy, createdAt);
    }
}
