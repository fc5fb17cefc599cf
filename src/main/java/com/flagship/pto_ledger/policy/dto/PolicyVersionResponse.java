package com.flagship.pto_ledger.policy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.policy.DisplayUnit;
import com.flagship.pto_ledger.policy.PolicyKind;
import com.flagship.pto_ledger.policy.PolicySettings;
import com.flagship.pto_ledger.policy.PolicyVersion;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PolicyVersionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("policy_id")
    UUID policyId;

    @JsonProperty("version")
    int version;

    @JsonProperty("effective_from")
    LocalDate effectiveFrom;

    @JsonProperty("effective_to")
    LocalDate effectiveTo;

    @JsonProperty("kind")
    PolicyKind kind;

    @JsonProperty("display_unit")
    DisplayUnit displayUnit;

    @JsonProperty("settings")
    PolicySettings settings;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PolicyVersionResponse from(PolicyVersion version) {
        return PolicyVersionResponse.builder()
            .id(version.getId())
            .policyId(version.getPolicyId())
            .version(version.getVersion())
            .effectiveFrom(version.getEffectiveFrom())
            .effectiveTo(version.getEffectiveTo())
            .kind(version.getKind())
            .displayUnit(version.getDisplayUnit())
            .settings(version.getSettings())
            .createdAt(version.getCreatedAt())
            .build();
    }
}
