package com.flagship.pto_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Manual correction of a balance. Positive amounts credit, negative amounts debit.
 */
@Value
public class CreateAdjustmentBody {

    @NotNull(message = "Employee ID is required")
    @JsonProperty("employee_id")
    UUID employeeId;

    @NotNull(message = "Policy ID is required")
    @JsonProperty("policy_id")
    UUID policyId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount_minutes")
    Integer amountMinutes;

    @JsonProperty("effective_date")
    LocalDate effectiveDate;

    @NotBlank(message = "Reason is required")
    @Size(max = 2000, message = "Reason is limited to 2000 characters")
    @JsonProperty("reason")
    String reason;
}
