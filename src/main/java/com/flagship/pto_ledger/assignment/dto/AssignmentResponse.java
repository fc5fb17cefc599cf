package com.flagship.pto_ledger.assignment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.assignment.Assignment;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class AssignmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("policy_id")
    UUID policyId;

    @JsonProperty("effective_from")
    LocalDate effectiveFrom;

    @JsonProperty("effective_to")
    LocalDate effectiveTo;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AssignmentResponse from(Assignment assignment) {
        return AssignmentResponse.builder()
            .id(assignment.getId())
            .employeeId(assignment.getEmployeeId())
            .policyId(assignment.getPolicyId())
            .effectiveFrom(assignment.getEffectiveFrom())
            .effectiveTo(assignment.getEffectiveTo())
            .createdAt(assignment.getCreatedAt())
            .build();
    }
}
