package com.flagship.pto_ledger.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Filters for reading the audit log of one company. Null fields do not filter;
 * {@code from} is inclusive, {@code to} exclusive.
 */
@Value
@Builder
public class AuditQuery {
    UUID companyId;
    AuditEntityType entityType;
    UUID entityId;
    AuditAction action;
    UUID actorId;
    Instant from;
    Instant to;
}
