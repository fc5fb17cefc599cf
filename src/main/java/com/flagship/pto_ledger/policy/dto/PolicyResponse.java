package com.flagship.pto_ledger.policy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.policy.PolicyCategory;
import com.flagship.pto_ledger.policy.TimeOffPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PolicyResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("key")
    String key;

    @JsonProperty("name")
    String name;

    @JsonProperty("category")
    PolicyCategory category;

    @JsonProperty("current_version")
    PolicyVersionResponse currentVersion;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PolicyResponse from(TimeOffPolicy policy, PolicyVersionResponse currentVersion) {
        return PolicyResponse.builder()
            .id(policy.getId())
            .companyId(policy.getCompanyId())
            .key(policy.getKey())
            .name(policy.getName())
            .category(policy.getCategory())
            .currentVersion(currentVersion)
            .createdAt(policy.getCreatedAt())
            .build();
    }
}
