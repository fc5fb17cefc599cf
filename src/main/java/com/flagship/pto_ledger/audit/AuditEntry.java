package com.flagship.pto_ledger.audit;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable audit record. {@code beforeJson} and {@code afterJson} are JSON documents of the
 * entity's state; either may be null (nothing before a create).
 */
@Value
public class AuditEntry {
    UUID id;
    UUID companyId;
    UUID actorId;
    AuditEntityType entityType;
    UUID entityId;
    AuditAction action;
    String beforeJson;
    String afterJson;
    String correlationId;
    Instant createdAt;
    Long sequenceNumber;
}
