package com.flagship.pto_ledger.policy;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Input for a new policy version.
 */
@Value
@Builder
public class NewPolicyVersion {
    LocalDate effectiveFrom;
    DisplayUnit displayUnit;
    PolicySettings settings;
    UUID createdBy;
}
