package com.flagship.pto_ledger.accrual;

import com.flagship.pto_ledger.assignment.Assignment;
import com.flagship.pto_ledger.assignment.AssignmentService;
import com.flagship.pto_ledger.directory.EmployeeDirectory;
import com.flagship.pto_ledger.exception.NoEffectiveVersionException;
import com.flagship.pto_ledger.exception.NotAccruableException;
import com.flagship.pto_ledger.exception.StoreFailures;
import com.flagship.pto_ledger.ledger.BalanceKey;
import com.flagship.pto_ledger.ledger.BalanceRules;
import com.flagship.pto_ledger.ledger.ConflictRetrier;
import com.flagship.pto_ledger.ledger.LedgerPostingService;
import com.flagship.pto_ledger.observability.CorrelationContext;
import com.flagship.pto_ledger.observability.PtoMetrics;
import com.flagship.pto_ledger.policy.PolicyVersion;
import com.flagship.pto_ledger.policy.PolicyVersionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Time-based accrual runs.
 *
 * Each assignment is its own transaction. A run tolerates per-assignment failures: unlimited
 * policies and missing versions count as skipped, other errors are counted and the run goes on.
 * Only store-level failures abort it. Reruns for the same date post nothing new, because every
 * accrual carries a deterministic source id per assignment and period.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccrualService {

    private final AssignmentService assignmentService;
    private final PolicyVersionStore versionStore;
    private final EmployeeDirectory employeeDirectory;
    private final AccrualEngine engine;
    private final LedgerPostingService postingService;
    private final ConflictRetrier retrier;
    private final PtoMetrics metrics;

    /**
     * @param companyId restricts the run to one company; null runs every company
     */
    public AccrualRunResult runAccruals(LocalDate targetDate, UUID companyId) {
        long startTime = System.currentTimeMillis();
        List<Assignment> assignments = assignmentService.findActiveAssignments(targetDate, companyId);

        int processed = 0;
        int accrued = 0;
        int skipped = 0;
        int errors = 0;

        for (Assignment assignment : assignments) {
            processed++;
            MDC.put(CorrelationContext.EMPLOYEE_ID_MDC_KEY, assignment.getEmployeeId().toString());
            MDC.put(CorrelationContext.POLICY_ID_MDC_KEY, assignment.getPolicyId().toString());
            try {
                boolean posted = retrier.execute("accrual", () -> accrue(assignment, targetDate));
                if (posted) {
                    accrued++;
                    metrics.recordAccrual("time", "accrued");
                } else {
                    skipped++;
                    metrics.recordAccrual("time", "skipped");
                }
            } catch (NotAccruableException | NoEffectiveVersionException e) {
                skipped++;
                metrics.recordAccrual("time", "not_accruable");
                log.debug("Skipping assignment {}: {}", assignment.getId(), e.getMessage());
            } catch (RuntimeException e) {
                if (StoreFailures.isFatal(e)) {
                    log.error("Aborting accrual run for {}: store failure", targetDate, e);
                    throw e;
                }
                errors++;
                metrics.recordAccrual("time", "error");
                log.error("Accrual failed: assignmentId={}, targetDate={}", assignment.getId(), targetDate, e);
            } finally {
                MDC.remove(CorrelationContext.EMPLOYEE_ID_MDC_KEY);
                MDC.remove(CorrelationContext.POLICY_ID_MDC_KEY);
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordLatency("accrual_run", duration);
        log.info("Accrual run complete: targetDate={}, companyId={}, processed={}, accrued={}, skipped={}, errors={}, duration={}ms",
                targetDate, companyId, processed, accrued, skipped, errors, duration);
        return new AccrualRunResult(targetDate, processed, accrued, skipped, errors);
    }

    private boolean accrue(Assignment assignment, LocalDate targetDate) {
        PolicyVersion version = versionStore.resolveEffective(assignment.getPolicyId(), targetDate);
        LocalDate hireDate = employeeDirectory
            .getSchedule(assignment.getCompanyId(), assignment.getEmployeeId())
            .getHireDate();

        Optional<AccrualDue> due = engine.timeAccrualDue(assignment, version, hireDate, targetDate);
        if (due.isEmpty()) {
            return false;
        }
        BalanceRules rules = version.getSettings().balanceRules();
        BalanceKey key = BalanceKey.of(assignment.getCompanyId(), assignment.getEmployeeId(), assignment.getPolicyId());
        return postingService.post(key, rules, engine.planner(due.get(), rules.getBankCapMinutes()))
            .wroteAnything();
    }
}
