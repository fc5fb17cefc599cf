package com.flagship.pto_ledger.assignment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;

@Value
public class EndAssignmentBody {

    @NotNull(message = "End date is required")
    @JsonProperty("effective_to")
    LocalDate effectiveTo;
}
