package com.flagship.pto_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pto_ledger.exception.DuplicateIdempotencyKeyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only ledger over plain JDBC.
 *
 * Invariants:
 * 1. Rows are never updated or deleted (a database trigger rejects both)
 * 2. {@code (source_type, source_id, entry_type)} is unique; inserts use
 *    {@code ON CONFLICT DO NOTHING} so a replay never aborts the surrounding transaction
 * 3. Balances are folds over these rows; see {@link #fold(BalanceKey)}
 */
@Repository
@Slf4j
public class LedgerStore {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final String SELECT_COLUMNS =
        "SELECT id, company_id, employee_id, policy_id, policy_version_id, entry_type, amount_minutes, " +
        "effective_at, source_type, source_id, metadata, created_at, sequence_number FROM ledger_entries ";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public LedgerStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Appends a posting, or returns the existing row when its idempotency key is taken.
     *
     * An existing row counts as a replay only if it belongs to the same balance and moves it in
     * the same direction; anything else is a key collision between different intents.
     *
     * @throws DuplicateIdempotencyKeyException on a collision between different intents
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AppendResult append(BalanceKey key, LedgerPosting posting) {
        UUID id = UUID.randomUUID();
        int rows = jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, company_id, employee_id, policy_id, policy_version_id, entry_type, " +
            "amount_minutes, effective_at, source_type, source_id, metadata, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (source_type, source_id, entry_type) DO NOTHING",
            id,
            key.getCompanyId(),
            key.getEmployeeId(),
            key.getPolicyId(),
            posting.getPolicyVersionId(),
            posting.getEntryType().name(),
            posting.getAmountMinutes(),
            Timestamp.from(posting.getEffectiveAt()),
            posting.getSourceType().name(),
            posting.getSourceId(),
            writeMetadata(posting.getMetadata())
        );

        if (rows == 1) {
            LedgerEntry stored = findById(id)
                .orElseThrow(() -> new IllegalStateException("Inserted ledger entry not readable: " + id));
            log.debug("Appended ledger entry: type={}, amount={}, source={}:{}",
                    posting.getEntryType(), posting.getAmountMinutes(), posting.getSourceType(), posting.getSourceId());
            return new AppendResult(stored, true);
        }

        LedgerEntry existing = findBySource(posting.getSourceType(), posting.getSourceId(), posting.getEntryType())
            .orElseThrow(() -> new IllegalStateException(
                "Ledger insert skipped but no conflicting row found for " + posting.getSourceId()));
        ensureSameIntent(key, posting, existing);
        log.debug("Ledger entry already present, treating as replay: type={}, source={}:{}",
                posting.getEntryType(), posting.getSourceType(), posting.getSourceId());
        return new AppendResult(existing, false);
    }

    /**
     * Throws if {@code existing} occupies the posting's idempotency key with a different intent.
     */
    public void ensureSameIntent(BalanceKey key, LedgerPosting posting, LedgerEntry existing) {
        boolean sameBalance = existing.balanceKey().equals(key);
        boolean sameDirection = Integer.signum(existing.getAmountMinutes()) == Integer.signum(posting.getAmountMinutes());
        if (!sameBalance || !sameDirection) {
            throw new DuplicateIdempotencyKeyException(String.format(
                "Idempotency key %s:%s:%s already used by entry %s for balance %s with amount %d",
                posting.getSourceType(), posting.getSourceId(), posting.getEntryType(),
                existing.getId(), existing.balanceKey(), existing.getAmountMinutes()));
        }
    }

    public Optional<LedgerEntry> findById(UUID id) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", ledgerEntryRowMapper(), id)
            .stream().findFirst();
    }

    public Optional<LedgerEntry> findBySource(LedgerSourceType sourceType, String sourceId, LedgerEntryType entryType) {
        return jdbcTemplate.query(
                SELECT_COLUMNS + "WHERE source_type = ? AND source_id = ? AND entry_type = ?",
                ledgerEntryRowMapper(),
                sourceType.name(), sourceId, entryType.name())
            .stream().findFirst();
    }

    /**
     * Entries for one balance in effective order; either bound may be null.
     * {@code from} is inclusive, {@code to} exclusive.
     */
    public List<LedgerEntry> listLedger(BalanceKey key, Instant from, Instant to) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS)
            .append("WHERE company_id = ? AND employee_id = ? AND policy_id = ?");
        List<Object> args = new ArrayList<>(List.of(key.getCompanyId(), key.getEmployeeId(), key.getPolicyId()));
        if (from != null) {
            sql.append(" AND effective_at >= ?");
            args.add(Timestamp.from(from));
        }
        if (to != null) {
            sql.append(" AND effective_at < ?");
            args.add(Timestamp.from(to));
        }
        sql.append(" ORDER BY effective_at, sequence_number");
        return jdbcTemplate.query(sql.toString(), ledgerEntryRowMapper(), args.toArray());
    }

    /**
     * One page of a company's ledger, newest first, for export. Null filters are ignored;
     * {@code from} is inclusive, {@code to} exclusive.
     */
    public Page<LedgerEntry> exportLedger(UUID companyId, UUID employeeId, UUID policyId,
                                          Instant from, Instant to, Pageable pageable) {
        StringBuilder where = new StringBuilder("WHERE company_id = ?");
        List<Object> args = new ArrayList<>(List.of(companyId));
        if (employeeId != null) {
            where.append(" AND employee_id = ?");
            args.add(employeeId);
        }
        if (policyId != null) {
            where.append(" AND policy_id = ?");
            args.add(policyId);
        }
        if (from != null) {
            where.append(" AND effective_at >= ?");
            args.add(Timestamp.from(from));
        }
        if (to != null) {
            where.append(" AND effective_at < ?");
            args.add(Timestamp.from(to));
        }

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries " + where, Long.class, args.toArray());
        List<Object> pageArgs = new ArrayList<>(args);
        pageArgs.add(pageable.getPageSize());
        pageArgs.add(pageable.getOffset());
        List<LedgerEntry> items = jdbcTemplate.query(
            SELECT_COLUMNS + where + " ORDER BY effective_at DESC, sequence_number DESC LIMIT ? OFFSET ?",
            ledgerEntryRowMapper(), pageArgs.toArray());
        return new PageImpl<>(items, pageable, total != null ? total : 0);
    }

    /**
     * Folds every entry of a balance into snapshot buckets.
     * The result carries version 0; callers own the snapshot row's version.
     */
    public BalanceSnapshot fold(BalanceKey key) {
        return jdbcTemplate.queryForObject(
            "SELECT " +
            "  COALESCE(SUM(CASE WHEN entry_type IN ('ACCRUAL', 'ADJUSTMENT', 'EXPIRATION', 'CARRYOVER') " +
            "                    THEN amount_minutes ELSE 0 END), 0) AS accrued, " +
            "  COALESCE(SUM(CASE WHEN entry_type = 'USAGE' THEN -amount_minutes ELSE 0 END), 0) AS used, " +
            "  COALESCE(SUM(CASE WHEN entry_type IN ('HOLD', 'HOLD_RELEASE') THEN -amount_minutes ELSE 0 END), 0) AS held " +
            "FROM ledger_entries WHERE company_id = ? AND employee_id = ? AND policy_id = ?",
            (rs, rowNum) -> new BalanceSnapshot(key, rs.getLong("accrued"), rs.getLong("used"), rs.getLong("held"), 0, null),
            key.getCompanyId(), key.getEmployeeId(), key.getPolicyId()
        );
    }

    /**
     * Plain sum of all amounts for a balance. Equals {@code accrued - used - held} of its fold.
     */
    public long sumAmounts(BalanceKey key) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount_minutes), 0) FROM ledger_entries " +
            "WHERE company_id = ? AND employee_id = ? AND policy_id = ?",
            Long.class,
            key.getCompanyId(), key.getEmployeeId(), key.getPolicyId());
        return sum != null ? sum : 0L;
    }

    /**
     * Sum of one entry type with {@code effective_at} in {@code [from, to)}.
     */
    public long sumAmounts(BalanceKey key, LedgerEntryType entryType, Instant from, Instant to) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount_minutes), 0) FROM ledger_entries " +
            "WHERE company_id = ? AND employee_id = ? AND policy_id = ? AND entry_type = ? " +
            "AND effective_at >= ? AND effective_at < ?",
            Long.class,
            key.getCompanyId(), key.getEmployeeId(), key.getPolicyId(), entryType.name(),
            Timestamp.from(from), Timestamp.from(to));
        return sum != null ? sum : 0L;
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize ledger metadata", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable ledger metadata: " + json, e);
        }
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("company_id", UUID.class),
            rs.getObject("employee_id", UUID.class),
            rs.getObject("policy_id", UUID.class),
            rs.getObject("policy_version_id", UUID.class),
            LedgerEntryType.valueOf(rs.getString("entry_type")),
            rs.getInt("amount_minutes"),
            rs.getTimestamp("effective_at").toInstant(),
            LedgerSourceType.valueOf(rs.getString("source_type")),
            rs.getString("source_id"),
            readMetadata(rs.getString("metadata")),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("sequence_number")
        );
    }
}
