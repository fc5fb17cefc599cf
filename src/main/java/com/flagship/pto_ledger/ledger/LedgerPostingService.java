package com.flagship.pto_ledger.ledger;

import com.flagship.pto_ledger.audit.AuditAction;
import com.flagship.pto_ledger.audit.AuditEntityType;
import com.flagship.pto_ledger.audit.AuditService;
import com.flagship.pto_ledger.exception.BalanceInvariantViolatedException;
import com.flagship.pto_ledger.observability.PtoMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The single write path into the ledger.
 *
 * One call is one unit of work on one balance key:
 * 1. Lock the snapshot row (creating it from the ledger fold if needed)
 * 2. Plan the postings against the locked state
 * 3. Separate replays (idempotency key already present) from new postings
 * 4. Check the balance invariant on the new postings, before anything is written
 * 5. Insert the new postings and move the snapshot by exactly what was inserted
 * 6. Write one audit record per inserted row
 *
 * Joins the caller's transaction when there is one, so request transitions commit their
 * status change, ledger rows, snapshot and outbox event together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerPostingService {

    private final BalanceProjector projector;
    private final LedgerStore ledgerStore;
    private final AuditService auditService;
    private final PtoMetrics metrics;

    @Transactional
    public PostingResult post(BalanceKey key, BalanceRules rules, List<LedgerPosting> postings) {
        return post(key, rules, locked -> postings);
    }

    /**
     * @throws BalanceInvariantViolatedException if the new postings would take the balance
     *         below what {@code rules} permit
     */
    @Transactional
    public PostingResult post(BalanceKey key, BalanceRules rules, PostingPlanner planner) {
        BalanceSnapshot locked = projector.lock(key);
        List<LedgerPosting> planned = planner.plan(locked);
        if (planned.isEmpty()) {
            return new PostingResult(List.of(), List.of(), locked);
        }

        List<LedgerPosting> fresh = new ArrayList<>();
        List<LedgerEntry> replayed = new ArrayList<>();
        for (LedgerPosting posting : planned) {
            Optional<LedgerEntry> existing =
                ledgerStore.findBySource(posting.getSourceType(), posting.getSourceId(), posting.getEntryType());
            if (existing.isPresent()) {
                ledgerStore.ensureSameIntent(key, posting, existing.get());
                replayed.add(existing.get());
                metrics.recordLedgerReplay(posting.getEntryType().name());
            } else {
                fresh.add(posting);
            }
        }

        checkInvariant(locked, locked.applyPostings(fresh), rules, fresh);

        List<LedgerEntry> inserted = new ArrayList<>();
        for (LedgerPosting posting : fresh) {
            AppendResult result = ledgerStore.append(key, posting);
            if (result.isInserted()) {
                inserted.add(result.getEntry());
                audit(result.getEntry());
            } else {
                replayed.add(result.getEntry());
            }
        }

        BalanceSnapshot snapshot = inserted.isEmpty()
            ? locked
            : projector.save(locked, locked.applyEntries(inserted));

        if (!inserted.isEmpty()) {
            log.debug("Posted {} ledger entries ({} replayed): key={}, available={}",
                    inserted.size(), replayed.size(), key, snapshot.availableMinutes());
        }
        return new PostingResult(List.copyOf(inserted), List.copyOf(replayed), snapshot);
    }

    private void audit(LedgerEntry entry) {
        auditService.record(entry.getCompanyId(), actorOf(entry), auditTypeOf(entry), entry.getId(),
                AuditAction.CREATE, null, entry);
    }

    private static AuditEntityType auditTypeOf(LedgerEntry entry) {
        return switch (entry.getEntryType()) {
            case ACCRUAL -> AuditEntityType.ACCRUAL;
            case ADJUSTMENT -> AuditEntityType.ADJUSTMENT;
            case CARRYOVER, EXPIRATION -> AuditEntityType.YEAR_END;
            case HOLD, HOLD_RELEASE, USAGE -> AuditEntityType.REQUEST_POSTING;
        };
    }

    /**
     * Administrators are recorded in the entry metadata; system writers have no actor.
     */
    private static UUID actorOf(LedgerEntry entry) {
        Object createdBy = entry.getMetadata() != null ? entry.getMetadata().get("createdBy") : null;
        if (createdBy == null) {
            return null;
        }
        try {
            return UUID.fromString(createdBy.toString());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed createdBy on ledger entry {}: {}", entry.getId(), createdBy);
            return null;
        }
    }

    /**
     * A write may never leave a negative bucket, and may not reduce the available balance below
     * the policy floor. Writes that do not reduce availability always pass, so accruals still post
     * into a balance that a rule change left below its new floor.
     */
    private void checkInvariant(BalanceSnapshot before, BalanceSnapshot after, BalanceRules rules,
                                List<LedgerPosting> postings) {
        String types = postings.stream().map(p -> p.getEntryType().name()).distinct()
            .reduce((a, b) -> a + "," + b).orElse("none");

        if (after.getHeldMinutes() < 0 || after.getUsedMinutes() < 0) {
            metrics.recordBalanceRefusal(types);
            throw new BalanceInvariantViolatedException(String.format(
                "Postings [%s] would leave a negative bucket on %s: used=%d, held=%d",
                types, before.getKey(), after.getUsedMinutes(), after.getHeldMinutes()),
                before.availableMinutes(), before.availableMinutes() - after.availableMinutes());
        }

        boolean reducesAvailable = after.availableMinutes() < before.availableMinutes();
        if (reducesAvailable && !rules.permits(after.availableMinutes())) {
            metrics.recordBalanceRefusal(types);
            throw new BalanceInvariantViolatedException(String.format(
                "Postings [%s] would take available balance on %s from %d to %d, below floor %d",
                types, before.getKey(), before.availableMinutes(), after.availableMinutes(), rules.floorMinutes()),
                before.availableMinutes(), before.availableMinutes() - after.availableMinutes());
        }
    }
}
