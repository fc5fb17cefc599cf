package com.flagship.pto_ledger.request.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.request.RequestStatus;
import com.flagship.pto_ledger.request.TimeOffRequest;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TimeOffRequestResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("policy_id")
    UUID policyId;

    @JsonProperty("start_at")
    Instant startAt;

    @JsonProperty("end_at")
    Instant endAt;

    @JsonProperty("requested_minutes")
    int requestedMinutes;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("status")
    RequestStatus status;

    @JsonProperty("submitted_at")
    Instant submittedAt;

    @JsonProperty("decided_at")
    Instant decidedAt;

    @JsonProperty("decided_by")
    UUID decidedBy;

    @JsonProperty("decision_note")
    String decisionNote;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TimeOffRequestResponse from(TimeOffRequest request) {
        return TimeOffRequestResponse.builder()
            .id(request.getId())
            .employeeId(request.getEmployeeId())
            .policyId(request.getPolicyId())
            .startAt(request.getStartAt())
            .endAt(request.getEndAt())
            .requestedMinutes(request.getRequestedMinutes())
            .reason(request.getReason())
            .status(request.getStatus())
            .submittedAt(request.getSubmittedAt())
            .decidedAt(request.getDecidedAt())
            .decidedBy(request.getDecidedBy())
            .decisionNote(request.getDecisionNote())
            .createdAt(request.getCreatedAt())
            .updatedAt(request.getUpdatedAt())
            .build();
    }
}
