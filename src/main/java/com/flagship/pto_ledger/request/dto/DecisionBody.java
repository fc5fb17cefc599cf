package com.flagship.pto_ledger.request.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class DecisionBody {

    @Size(max = 2000, message = "Note is limited to 2000 characters")
    @JsonProperty("note")
    String note;
}
