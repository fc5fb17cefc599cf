package com.flagship.pto_ledger.carryover;

import com.flagship.pto_ledger.assignment.Assignment;
import com.flagship.pto_ledger.assignment.AssignmentService;
import com.flagship.pto_ledger.exception.StoreFailures;
import com.flagship.pto_ledger.ledger.BalanceKey;
import com.flagship.pto_ledger.ledger.BalanceRules;
import com.flagship.pto_ledger.ledger.BalanceSnapshot;
import com.flagship.pto_ledger.ledger.ConflictRetrier;
import com.flagship.pto_ledger.ledger.LedgerEntry;
import com.flagship.pto_ledger.ledger.LedgerEntryType;
import com.flagship.pto_ledger.ledger.LedgerPosting;
import com.flagship.pto_ledger.ledger.LedgerPostingService;
import com.flagship.pto_ledger.ledger.LedgerSourceType;
import com.flagship.pto_ledger.ledger.LedgerStore;
import com.flagship.pto_ledger.ledger.PostingPlanner;
import com.flagship.pto_ledger.ledger.PostingResult;
import com.flagship.pto_ledger.observability.CorrelationContext;
import com.flagship.pto_ledger.observability.PtoMetrics;
import com.flagship.pto_ledger.policy.CarryoverSettings;
import com.flagship.pto_ledger.policy.ExpirationSettings;
import com.flagship.pto_ledger.policy.PolicyVersion;
import com.flagship.pto_ledger.policy.PolicyVersionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Year-end carryover and balance expiration.
 *
 * Both runs are date-driven and safe to repeat: every entry gets a source id keyed by
 * assignment, period and rule kind, and amounts are computed against the locked balance.
 * Entries never touch held minutes; only the available balance rolls over or expires.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CarryoverService {

    private final AssignmentService assignmentService;
    private final PolicyVersionStore versionStore;
    private final LedgerStore ledgerStore;
    private final LedgerPostingService postingService;
    private final ConflictRetrier retrier;
    private final PtoMetrics metrics;

    /**
     * Rolls balances over for every policy whose carryover boundary is {@code targetDate}.
     *
     * The rules are those of the version in force on the last day of the closing year. Of the
     * available balance {@code A > 0}, {@code min(A, cap)} carries forward and the rest expires;
     * a zero-amount CARRYOVER entry records what was carried.
     */
    public YearEndRunResult runCarryover(LocalDate targetDate, UUID companyId) {
        LocalDate closingDay = targetDate.minusDays(1);
        return run("carryover", targetDate, assignmentService.findActiveAssignments(closingDay, companyId),
                assignment -> {
                    Optional<PolicyVersion> version = versionStore.findEffective(assignment.getPolicyId(), closingDay);
                    CarryoverSettings carryover = version.map(v -> v.getSettings().carryoverRules()).orElse(null);
                    if (carryover == null || !carryover.isEnabled()
                            || !carryover.boundary().equals(MonthDay.from(targetDate))) {
                        return null;
                    }
                    return carryoverPlanner(assignment, version.get(), carryover, targetDate);
                });
    }

    /**
     * Applies the expiration rules due on {@code targetDate}:
     * a calendar-date rule expires the whole available balance, carried-over minutes expire
     * {@code expiresAfterDays} after the boundary, and accruals older than
     * {@code expiresAfterDays} expire as they age out.
     */
    public YearEndRunResult runExpiration(LocalDate targetDate, UUID companyId) {
        return run("expiration", targetDate, assignmentService.findActiveAssignments(targetDate, companyId),
                assignment -> {
                    Optional<PolicyVersion> version = versionStore.findEffective(assignment.getPolicyId(), targetDate);
                    if (version.isEmpty()) {
                        return null;
                    }
                    List<PostingPlanner> due = new ArrayList<>();
                    ExpirationSettings expiration = version.get().getSettings().expirationRules();
                    CarryoverSettings carryover = version.get().getSettings().carryoverRules();

                    if (expiration != null && expiration.isEnabled()) {
                        MonthDay calendarDate = expiration.calendarDate();
                        if (calendarDate != null && calendarDate.equals(MonthDay.from(targetDate))) {
                            due.add(calendarExpirationPlanner(assignment, version.get(), targetDate));
                        }
                        if (expiration.getExpiresAfterDays() != null) {
                            due.add(agedExpirationPlanner(assignment, version.get(),
                                    targetDate.minusDays(expiration.getExpiresAfterDays()), targetDate));
                        }
                    }
                    if (carryover != null && carryover.isEnabled() && carryover.getExpiresAfterDays() != null) {
                        LocalDate boundaryDate = targetDate.minusDays(carryover.getExpiresAfterDays());
                        if (carryover.boundary().equals(MonthDay.from(boundaryDate))) {
                            due.add(carryoverExpiryPlanner(assignment, version.get(), boundaryDate, targetDate));
                        }
                    }
                    if (due.isEmpty()) {
                        return null;
                    }
                    return locked -> {
                        List<LedgerPosting> postings = new ArrayList<>();
                        BalanceSnapshot running = locked;
                        for (PostingPlanner planner : due) {
                            List<LedgerPosting> planned = planner.plan(running);
                            running = running.applyPostings(planned);
                            postings.addAll(planned);
                        }
                        return postings;
                    };
                });
    }

    private YearEndRunResult run(String kind, LocalDate targetDate, List<Assignment> assignments,
                                 PlannerSource plannerSource) {
        long startTime = System.currentTimeMillis();
        int processed = 0;
        int carryovers = 0;
        int expirations = 0;
        int skipped = 0;
        int errors = 0;

        for (Assignment assignment : assignments) {
            processed++;
            MDC.put(CorrelationContext.EMPLOYEE_ID_MDC_KEY, assignment.getEmployeeId().toString());
            MDC.put(CorrelationContext.POLICY_ID_MDC_KEY, assignment.getPolicyId().toString());
            try {
                PostingResult result = retrier.execute(kind, () -> {
                    PostingPlanner planner = plannerSource.plannerFor(assignment);
                    if (planner == null) {
                        return null;
                    }
                    // Expiring or carrying over is never refused by the balance floor.
                    return postingService.post(keyOf(assignment),
                            BalanceRules.unlimitedBalance(), planner);
                });
                if (result == null || !result.wroteAnything()) {
                    skipped++;
                    metrics.recordYearEnd(kind, "skipped");
                    continue;
                }
                if (result.insertedOfType(LedgerEntryType.CARRYOVER).isPresent()) {
                    carryovers++;
                }
                long expired = result.getInserted().stream()
                    .filter(e -> e.getEntryType() == LedgerEntryType.EXPIRATION)
                    .count();
                expirations += (int) expired;
                metrics.recordYearEnd(kind, "posted");
            } catch (RuntimeException e) {
                if (StoreFailures.isFatal(e)) {
                    log.error("Aborting {} run for {}: store failure", kind, targetDate, e);
                    throw e;
                }
                errors++;
                metrics.recordYearEnd(kind, "error");
                log.error("{} failed: assignmentId={}, targetDate={}", kind, assignment.getId(), targetDate, e);
            } finally {
                MDC.remove(CorrelationContext.EMPLOYEE_ID_MDC_KEY);
                MDC.remove(CorrelationContext.POLICY_ID_MDC_KEY);
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordLatency(kind + "_run", duration);
        log.info("{} run complete: targetDate={}, processed={}, carryovers={}, expirations={}, skipped={}, errors={}, duration={}ms",
                kind, targetDate, processed, carryovers, expirations, skipped, errors, duration);
        return new YearEndRunResult(targetDate, processed, carryovers, expirations, skipped, errors);
    }

    private PostingPlanner carryoverPlanner(Assignment assignment, PolicyVersion version,
                                            CarryoverSettings carryover, LocalDate boundaryDate) {
        int closedYear = boundaryDate.minusDays(1).getYear();
        Instant effectiveAt = startOf(boundaryDate);
        String markerId = sourceId("carryover", assignment, String.valueOf(closedYear), "carryover");
        return locked -> {
            // The year is closed once its marker exists; later balance changes belong to the new year.
            if (ledgerStore.findBySource(LedgerSourceType.SYSTEM, markerId, LedgerEntryType.CARRYOVER).isPresent()) {
                return List.of();
            }
            long available = locked.availableMinutes();
            if (available <= 0) {
                return List.of();
            }
            long carried = carryover.getCapMinutes() == null ? available : Math.min(available, carryover.getCapMinutes());
            long excess = available - carried;

            List<LedgerPosting> postings = new ArrayList<>();
            if (excess > 0) {
                postings.add(systemPosting(LedgerEntryType.EXPIRATION, -Math.toIntExact(excess),
                        sourceId("carryover", assignment, String.valueOf(closedYear), "excess"), effectiveAt, version,
                        Map.of("reason", "carryover_cap_exceeded", "closedYear", closedYear,
                                "expiredMinutes", excess)));
            }
            Map<String, Object> marker = new LinkedHashMap<>();
            marker.put("closedYear", closedYear);
            marker.put("carriedMinutes", carried);
            marker.put("expiredMinutes", excess);
            marker.put("capMinutes", carryover.getCapMinutes());
            marker.put("expiresAfterDays", carryover.getExpiresAfterDays());
            postings.add(systemPosting(LedgerEntryType.CARRYOVER, 0, markerId, effectiveAt, version, marker));
            return postings;
        };
    }

    private PostingPlanner calendarExpirationPlanner(Assignment assignment, PolicyVersion version, LocalDate targetDate) {
        return locked -> {
            long available = locked.availableMinutes();
            if (available <= 0) {
                return List.of();
            }
            return List.of(systemPosting(LedgerEntryType.EXPIRATION, -Math.toIntExact(available),
                    sourceId("expiration", assignment, String.valueOf(targetDate.getYear()), "calendar"),
                    startOf(targetDate), version,
                    Map.of("reason", "calendar_date_expiration", "expiredMinutes", available,
                            "expiresOn", MonthDay.from(targetDate).toString())));
        };
    }

    /**
     * Expires what is left of the minutes carried at {@code boundaryDate}: the carried amount,
     * or less if part of it has been spent.
     */
    private PostingPlanner carryoverExpiryPlanner(Assignment assignment, PolicyVersion version,
                                                  LocalDate boundaryDate, LocalDate targetDate) {
        String closedYear = String.valueOf(boundaryDate.minusDays(1).getYear());
        return locked -> {
            Optional<LedgerEntry> marker = ledgerStore.findBySource(LedgerSourceType.SYSTEM,
                    sourceId("carryover", assignment, closedYear, "carryover"), LedgerEntryType.CARRYOVER);
            if (marker.isEmpty()) {
                return List.of();
            }
            long carried = ((Number) marker.get().getMetadata().getOrDefault("carriedMinutes", 0)).longValue();
            long expire = Math.min(carried, Math.max(locked.availableMinutes(), 0));
            if (expire <= 0) {
                return List.of();
            }
            return List.of(systemPosting(LedgerEntryType.EXPIRATION, -Math.toIntExact(expire),
                    sourceId("carryover", assignment, closedYear, "carryover-expiry"), startOf(targetDate), version,
                    Map.of("reason", "carryover_expired", "closedYear", closedYear, "expiredMinutes", expire,
                            "carriedMinutes", carried)));
        };
    }

    /**
     * Expires the accruals posted on {@code agedDate}, bounded by what is still available.
     */
    private PostingPlanner agedExpirationPlanner(Assignment assignment, PolicyVersion version,
                                                 LocalDate agedDate, LocalDate targetDate) {
        return locked -> {
            long aged = ledgerStore.sumAmounts(locked.getKey(), LedgerEntryType.ACCRUAL,
                    startOf(agedDate), startOf(agedDate.plusDays(1)));
            long expire = Math.min(aged, Math.max(locked.availableMinutes(), 0));
            if (expire <= 0) {
                return List.of();
            }
            return List.of(systemPosting(LedgerEntryType.EXPIRATION, -Math.toIntExact(expire),
                    sourceId("expiration", assignment, agedDate.toString(), "aged"), startOf(targetDate), version,
                    Map.of("reason", "accrual_aged_out", "accruedOn", agedDate.toString(), "expiredMinutes", expire)));
        };
    }

    private static LedgerPosting systemPosting(LedgerEntryType type, int amount, String sourceId, Instant effectiveAt,
                                               PolicyVersion version, Map<String, Object> metadata) {
        return LedgerPosting.builder()
            .entryType(type)
            .amountMinutes(amount)
            .sourceType(LedgerSourceType.SYSTEM)
            .sourceId(sourceId)
            .effectiveAt(effectiveAt)
            .policyVersionId(version.getId())
            .metadata(metadata)
            .build();
    }

    private static String sourceId(String prefix, Assignment assignment, String period, String ruleKind) {
        return prefix + ":" + assignment.getId() + ":" + period + ":" + ruleKind;
    }

    private static Instant startOf(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private static BalanceKey keyOf(Assignment assignment) {
        return BalanceKey.of(assignment.getCompanyId(), assignment.getEmployeeId(), assignment.getPolicyId());
    }

    /**
     * Builds the planner for one assignment, or returns null when nothing is due.
     */
    @FunctionalInterface
    private interface PlannerSource {
        PostingPlanner plannerFor(Assignment assignment);
    }
}
