package com.flagship.pto_ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pto_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Append-only audit trail.
 *
 * {@link #record} only works inside the caller's transaction, so an audit row exists exactly when
 * the change it describes committed. Rows are never updated or deleted (a database trigger
 * rejects both).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private static final String SELECT_COLUMNS =
        "SELECT id, company_id, actor_id, entity_type, entity_id, action, before_json, after_json, " +
        "correlation_id, created_at, sequence_number FROM audit_log ";

    private final AuditLogRepository repository;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @param before state before the change, serialized to JSON; null for creations
     * @param after  state after the change, serialized to JSON
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEntry record(UUID companyId, UUID actorId, AuditEntityType entityType, UUID entityId,
                             AuditAction action, Object before, Object after) {
        AuditEntry entry = new AuditEntry(
            UUID.randomUUID(),
            companyId,
            actorId,
            entityType,
            entityId,
            action,
            toJson(before),
            toJson(after),
            CorrelationContext.getCorrelationId(),
            clock.instant(),
            null
        );
        repository.save(AuditLogEntity.fromDomain(entry));
        log.debug("Audited {} {}: entityId={}, actorId={}", action, entityType, entityId, actorId);
        return entry;
    }

    /**
     * Every audit record of one entity, oldest first.
     */
    @Transactional(readOnly = true)
    public List<AuditEntry> getTrail(UUID companyId, AuditEntityType entityType, UUID entityId) {
        return repository.findByCompanyIdAndEntityTypeAndEntityIdOrderBySequenceNumberAsc(companyId, entityType, entityId)
            .stream()
            .map(AuditLogEntity::toDomain)
            .toList();
    }

    /**
     * Filtered audit records, newest first.
     */
    @Transactional(readOnly = true)
    public Page<AuditEntry> queryAuditLog(AuditQuery query, Pageable pageable) {
        StringBuilder where = new StringBuilder("WHERE company_id = ?");
        List<Object> args = new ArrayList<>(List.of(query.getCompanyId()));
        if (query.getEntityType() != null) {
            where.append(" AND entity_type = ?");
            args.add(query.getEntityType().name());
        }
        if (query.getEntityId() != null) {
            where.append(" AND entity_id = ?");
            args.add(query.getEntityId());
        }
        if (query.getAction() != null) {
            where.append(" AND action = ?");
            args.add(query.getAction().name());
        }
        if (query.getActorId() != null) {
            where.append(" AND actor_id = ?");
            args.add(query.getActorId());
        }
        if (query.getFrom() != null) {
            where.append(" AND created_at >= ?");
            args.add(Timestamp.from(query.getFrom()));
        }
        if (query.getTo() != null) {
            where.append(" AND created_at < ?");
            args.add(Timestamp.from(query.getTo()));
        }

        Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM audit_log " + where, Long.class, args.toArray());

        List<Object> pageArgs = new ArrayList<>(args);
        pageArgs.add(pageable.getPageSize());
        pageArgs.add(pageable.getOffset());
        List<AuditEntry> items = jdbcTemplate.query(
            SELECT_COLUMNS + where + " ORDER BY created_at DESC, sequence_number DESC LIMIT ? OFFSET ?",
            auditRowMapper(), pageArgs.toArray());
        return new PageImpl<>(items, pageable, total != null ? total : 0);
    }

    private String toJson(Object state) {
        if (state == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit state: " + state.getClass().getSimpleName(), e);
        }
    }

    private RowMapper<AuditEntry> auditRowMapper() {
        return (rs, rowNum) -> new AuditEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("company_id", UUID.class),
            rs.getObject("actor_id", UUID.class),
            AuditEntityType.valueOf(rs.getString("entity_type")),
            rs.getObject("entity_id", UUID.class),
            AuditAction.valueOf(rs.getString("action")),
            rs.getString("before_json"),
            rs.getString("after_json"),
            rs.getString("correlation_id"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("sequence_number")
        );
    }
}
