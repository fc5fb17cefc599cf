package com.flagship.pto_ledger.ledger.dto;

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
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

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

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
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
