package com.flagship.pto_ledger.ledger;

import com.flagship.pto_ledger.exception.ConcurrencyConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.Optional;
import java.util.UUID;

/**
 * Maintains {@code balance_snapshots}, the per-key cache of the ledger fold.
 *
 * The snapshot row doubles as the lock for its balance key: every writer takes
 * {@code SELECT ... FOR UPDATE} on it first, with a bounded lock wait. A missing row is
 * created from the ledger fold before it is locked, so the first writer and a rebuild agree.
 */
@Component
@Slf4j
public class BalanceProjector {

    private static final String SELECT_SNAPSHOT =
        "SELECT company_id, employee_id, policy_id, accrued_minutes, used_minutes, held_minutes, version, updated_at " +
        "FROM balance_snapshots WHERE company_id = ? AND employee_id = ? AND policy_id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerStore ledgerStore;
    private final long lockTimeoutMs;

    public BalanceProjector(JdbcTemplate jdbcTemplate, LedgerStore ledgerStore,
                            @Value("${pto.concurrency.lock-timeout-ms:5000}") long lockTimeoutMs) {
        this.jdbcTemplate = jdbcTemplate;
        this.ledgerStore = ledgerStore;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * Locks the snapshot for {@code key} until the surrounding transaction ends,
     * creating it from the ledger fold when absent.
     *
     * @throws ConcurrencyConflictException if the lock is not granted within the configured wait
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceSnapshot lock(BalanceKey key) {
        try {
            boundLockWait();

            Optional<BalanceSnapshot> locked = selectForUpdate(key);
            if (locked.isPresent()) {
                return locked.get();
            }

            BalanceSnapshot folded = ledgerStore.fold(key);
            int created = jdbcTemplate.update(
                "INSERT INTO balance_snapshots (company_id, employee_id, policy_id, accrued_minutes, used_minutes, " +
                "held_minutes, version, updated_at) VALUES (?, ?, ?, ?, ?, ?, 0, CURRENT_TIMESTAMP) " +
                "ON CONFLICT (company_id, employee_id, policy_id) DO NOTHING",
                key.getCompanyId(), key.getEmployeeId(), key.getPolicyId(),
                folded.getAccruedMinutes(), folded.getUsedMinutes(), folded.getHeldMinutes());
            if (created == 1) {
                log.debug("Created balance snapshot from ledger fold: key={}, accrued={}, used={}, held={}",
                        key, folded.getAccruedMinutes(), folded.getUsedMinutes(), folded.getHeldMinutes());
            }

            return selectForUpdate(key)
                .orElseThrow(() -> new IllegalStateException("Balance snapshot vanished after insert: " + key));
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Timed out waiting for balance lock: " + key, e);
        }
    }

    /**
     * Caps how long any row lock taken later in the current transaction may wait.
     * Callers that lock other rows before the snapshot (the request row) call this first.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void boundLockWait() {
        jdbcTemplate.execute("SET LOCAL lock_timeout = " + lockTimeoutMs);
    }

    /**
     * Writes {@code updated} over {@code locked}, bumping the version.
     *
     * @throws ConcurrencyConflictException if the stored version no longer matches {@code locked}
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceSnapshot save(BalanceSnapshot locked, BalanceSnapshot updated) {
        BalanceKey key = locked.getKey();
        int rows = jdbcTemplate.update(
            "UPDATE balance_snapshots SET accrued_minutes = ?, used_minutes = ?, held_minutes = ?, " +
            "version = version + 1, updated_at = CURRENT_TIMESTAMP " +
            "WHERE company_id = ? AND employee_id = ? AND policy_id = ? AND version = ?",
            updated.getAccruedMinutes(), updated.getUsedMinutes(), updated.getHeldMinutes(),
            key.getCompanyId(), key.getEmployeeId(), key.getPolicyId(), locked.getVersion());

        if (rows == 0) {
            throw new ConcurrencyConflictException(String.format(
                "Balance snapshot %s changed since version %d", key, locked.getVersion()));
        }
        return find(key).orElseThrow(() -> new IllegalStateException("Balance snapshot missing after update: " + key));
    }

    /**
     * Re-folds the ledger into the snapshot under lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceSnapshot rebuild(BalanceKey key) {
        BalanceSnapshot locked = lock(key);
        BalanceSnapshot folded = ledgerStore.fold(key);
        if (!locked.hasSameBucketsAs(folded)) {
            log.warn("Balance snapshot drifted from ledger, rebuilding: key={}, snapshot=[{}, {}, {}], ledger=[{}, {}, {}]",
                    key, locked.getAccruedMinutes(), locked.getUsedMinutes(), locked.getHeldMinutes(),
                    folded.getAccruedMinutes(), folded.getUsedMinutes(), folded.getHeldMinutes());
        }
        return save(locked, folded);
    }

    public Optional<BalanceSnapshot> find(BalanceKey key) {
        return jdbcTemplate.query(SELECT_SNAPSHOT, snapshotRowMapper(),
                key.getCompanyId(), key.getEmployeeId(), key.getPolicyId())
            .stream().findFirst();
    }

    private Optional<BalanceSnapshot> selectForUpdate(BalanceKey key) {
        return jdbcTemplate.query(SELECT_SNAPSHOT + " FOR UPDATE", snapshotRowMapper(),
                key.getCompanyId(), key.getEmployeeId(), key.getPolicyId())
            .stream().findFirst();
    }

    private RowMapper<BalanceSnapshot> snapshotRowMapper() {
        return (rs, rowNum) -> {
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return new BalanceSnapshot(
                BalanceKey.of(
                    rs.getObject("company_id", UUID.class),
                    rs.getObject("employee_id", UUID.class),
                    rs.getObject("policy_id", UUID.class)),
                rs.getLong("accrued_minutes"),
                rs.getLong("used_minutes"),
                rs.getLong("held_minutes"),
                rs.getLong("version"),
                updatedAt != null ? updatedAt.toInstant() : null
            );
        };
    }
}
