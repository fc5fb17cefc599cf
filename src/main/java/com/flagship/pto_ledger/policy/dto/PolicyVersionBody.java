package com.flagship.pto_ledger.policy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.policy.DisplayUnit;
import com.flagship.pto_ledger.policy.NewPolicyVersion;
import com.flagship.pto_ledger.policy.PolicySettings;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Rules for a new policy version. {@code settings} carries a {@code type} discriminator
 * ({@code UNLIMITED}, {@code TIME_ACCRUAL} or {@code HOURS_WORKED_ACCRUAL}).
 */
@Value
public class PolicyVersionBody {

    @NotNull(message = "Effective date is required")
    @JsonProperty("effective_from")
    LocalDate effectiveFrom;

    @JsonProperty("display_unit")
    DisplayUnit displayUnit;

    @NotNull(message = "Settings are required")
    @JsonProperty("settings")
    PolicySettings settings;

    public NewPolicyVersion toCommand(UUID actorId) {
        return NewPolicyVersion.builder()
            .effectiveFrom(effectiveFrom)
            .displayUnit(displayUnit)
            .settings(settings)
            .createdBy(actorId)
            .build();
    }
}
