package com.flagship.pto_ledger.assignment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
public class CreateAssignmentBody {

    @NotNull(message = "Employee ID is required")
    @JsonProperty("employee_id")
    UUID employeeId;

    @NotNull(message = "Policy ID is required")
    @JsonProperty("policy_id")
    UUID policyId;

    @NotNull(message = "Effective date is required")
    @JsonProperty("effective_from")
    LocalDate effectiveFrom;

    @JsonProperty("effective_to")
    LocalDate effectiveTo;
}
