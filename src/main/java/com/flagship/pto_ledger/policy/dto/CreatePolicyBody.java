package com.flagship.pto_ledger.policy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.policy.PolicyCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CreatePolicyBody {

    @NotBlank(message = "Policy key is required")
    @Size(max = 100, message = "Policy key is limited to 100 characters")
    @JsonProperty("key")
    String key;

    @JsonProperty("name")
    String name;

    @JsonProperty("category")
    PolicyCategory category;

    @NotNull(message = "Initial version is required")
    @Valid
    @JsonProperty("version")
    PolicyVersionBody version;
}
