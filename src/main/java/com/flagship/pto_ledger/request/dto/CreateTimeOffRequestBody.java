package com.flagship.pto_ledger.request.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.request.NewTimeOffRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.UUID;

/**
 * Body for creating a request. {@code start_at}/{@code end_at} accept ISO date-times with an
 * offset, or without one to mean the employee's local wall-clock time.
 */
@Value
public class CreateTimeOffRequestBody {

    @NotNull(message = "Employee ID is required")
    @JsonProperty("employee_id")
    UUID employeeId;

    @NotNull(message = "Policy ID is required")
    @JsonProperty("policy_id")
    UUID policyId;

    @NotBlank(message = "Start time is required")
    @JsonProperty("start_at")
    String startAt;

    @NotBlank(message = "End time is required")
    @JsonProperty("end_at")
    String endAt;

    @Size(max = 2000, message = "Reason is limited to 2000 characters")
    @JsonProperty("reason")
    String reason;

    public NewTimeOffRequest toCommand(UUID companyId, String idempotencyKey, UUID actorId) {
        NewTimeOffRequest.NewTimeOffRequestBuilder builder = NewTimeOffRequest.builder()
            .companyId(companyId)
            .employeeId(employeeId)
            .policyId(policyId)
            .reason(reason)
            .idempotencyKey(idempotencyKey)
            .actorId(actorId != null ? actorId : employeeId);

        TemporalAccessor start = parse(startAt, "start_at");
        if (start instanceof OffsetDateTime offset) {
            builder.startAt(offset.toInstant());
        } else {
            builder.localStartAt((LocalDateTime) start);
        }
        TemporalAccessor end = parse(endAt, "end_at");
        if (end instanceof OffsetDateTime offset) {
            builder.endAt(offset.toInstant());
        } else {
            builder.localEndAt((LocalDateTime) end);
        }
        return builder.build();
    }

    private static TemporalAccessor parse(String value, String field) {
        try {
            return DateTimeFormatter.ISO_DATE_TIME.parseBest(value, OffsetDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + field + ": " + value);
        }
    }
}
