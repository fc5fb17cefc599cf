package com.flagship.pto_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.ledger.LedgerEntry;
import com.flagship.pto_ledger.ledger.LedgerEntryType;
import com.flagship.pto_ledger.ledger.LedgerSourceType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class LedgerExportEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("policy_id")
    UUID policyId;

    @JsonProperty("policy_version_id")
    UUID policyVersionId;

    @JsonProperty("entry_type")
    LedgerEntryType entryType;

    @JsonProperty("amount_minutes")
    int amountMinutes;

    @JsonProperty("effective_at")
    Instant effectiveAt;

    @JsonProperty("source_type")
    LedgerSourceType sourceType;

    @JsonProperty("source_id")
    String sourceId;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerExportEntryResponse from(LedgerEntry entry) {
        return LedgerExportEntryResponse.builder()
            .id(entry.getId())
            .employeeId(entry.getEmployeeId())
            .policyId(entry.getPolicyId())
            .policyVersionId(entry.getPolicyVersionId())
            .entryType(entry.getEntryType())
            .amountMinutes(entry.getAmountMinutes())
            .effectiveAt(entry.getEffectiveAt())
            .sourceType(entry.getSourceType())
            .sourceId(entry.getSourceId())
            .metadata(entry.getMetadata())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
