package com.flagship.pto_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.flagship.pto_ledger.audit.AuditAction;
import com.flagship.pto_ledger.audit.AuditEntityType;
import com.flagship.pto_ledger.audit.AuditEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An audit record. {@code before} and {@code after} are embedded as JSON objects.
 */
@Value
@Builder
public class AuditEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("actor_id")
    UUID actorId;

    @JsonProperty("entity_type")
    AuditEntityType entityType;

    @JsonProperty("entity_id")
    UUID entityId;

    @JsonProperty("action")
    AuditAction action;

    @JsonRawValue
    @JsonProperty("before")
    String before;

    @JsonRawValue
    @JsonProperty("after")
    String after;

    @JsonProperty("correlation_id")
    String correlationId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AuditEntryResponse from(AuditEntry entry) {
        return AuditEntryResponse.builder()
            .id(entry.getId())
            .actorId(entry.getActorId())
            .entityType(entry.getEntityType())
            .entityId(entry.getEntityId())
            .action(entry.getAction())
            .before(entry.getBeforeJson())
            .after(entry.getAfterJson())
            .correlationId(entry.getCorrelationId())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
