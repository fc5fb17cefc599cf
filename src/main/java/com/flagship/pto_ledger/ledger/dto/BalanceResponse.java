package com.flagship.pto_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.ledger.BalanceView;
import com.flagship.pto_ledger.policy.DisplayUnit;
import com.flagship.pto_ledger.policy.PolicyKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Balance in minutes. {@code available_minutes} is null for unlimited policies.
 */
@Value
@Builder
public class BalanceResponse {

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("policy_id")
    UUID policyId;

    @JsonProperty("kind")
    PolicyKind kind;

    @JsonProperty("display_unit")
    DisplayUnit displayUnit;

    @JsonProperty("accrued_minutes")
    long accruedMinutes;

    @JsonProperty("used_minutes")
    long usedMinutes;

    @JsonProperty("held_minutes")
    long heldMinutes;

    @JsonProperty("available_minutes")
    Long availableMinutes;

    @JsonProperty("version")
    long version;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static BalanceResponse from(BalanceView view) {
        return BalanceResponse.builder()
            .employeeId(view.getEmployeeId())
            .policyId(view.getPolicyId())
            .kind(view.getKind())
            .displayUnit(view.getDisplayUnit())
            .accruedMinutes(view.getAccruedMinutes())
            .usedMinutes(view.getUsedMinutes())
            .heldMinutes(view.getHeldMinutes())
            .availableMinutes(view.getAvailableMinutes())
            .version(view.getVersion())
            .updatedAt(view.getUpdatedAt())
            .build();
    }
}
