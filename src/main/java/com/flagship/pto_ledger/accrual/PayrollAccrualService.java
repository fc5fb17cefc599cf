package com.flagship.pto_ledger.accrual;

import com.flagship.pto_ledger.assignment.Assignment;
import com.flagship.pto_ledger.assignment.AssignmentService;
import com.flagship.pto_ledger.exception.StoreFailures;
import com.flagship.pto_ledger.ledger.BalanceKey;
import com.flagship.pto_ledger.ledger.BalanceRules;
import com.flagship.pto_ledger.ledger.ConflictRetrier;
import com.flagship.pto_ledger.ledger.LedgerPostingService;
import com.flagship.pto_ledger.observability.CorrelationContext;
import com.flagship.pto_ledger.observability.PtoMetrics;
import com.flagship.pto_ledger.policy.PolicyKind;
import com.flagship.pto_ledger.policy.PolicyVersion;
import com.flagship.pto_ledger.policy.PolicyVersionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Hours-worked accrual from processed payroll runs.
 *
 * For every entry, each of the employee's hours-worked assignments active on the period end
 * earns {@code floor(worked × ratio)}. Source ids are derived from the payroll run id, so a
 * replayed run writes nothing and reports its entries as skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayrollAccrualService {

    private final AssignmentService assignmentService;
    private final PolicyVersionStore versionStore;
    private final AccrualEngine engine;
    private final LedgerPostingService postingService;
    private final ConflictRetrier retrier;
    private final PtoMetrics metrics;

    public PayrollProcessingResult processPayroll(PayrollPayload payload) {
        payload.validate();
        long startTime = System.currentTimeMillis();

        int processed = 0;
        int accrued = 0;
        int skipped = 0;
        int errors = 0;

        for (PayrollPayload.Entry entry : payload.getEntries()) {
            MDC.put(CorrelationContext.EMPLOYEE_ID_MDC_KEY, entry.getEmployeeId().toString());
            try {
                for (Assignment assignment : assignmentService.findActiveAssignments(
                        payload.getCompanyId(), entry.getEmployeeId(), payload.getPeriodEnd())) {
                    Optional<PolicyVersion> version =
                        versionStore.findEffective(assignment.getPolicyId(), payload.getPeriodEnd());
                    if (version.isPresent() && version.get().getKind() != PolicyKind.HOURS_WORKED_ACCRUAL) {
                        continue;
                    }
                    processed++;
                    if (version.isEmpty()) {
                        skipped++;
                        metrics.recordAccrual("payroll", "no_version");
                        continue;
                    }

                    MDC.put(CorrelationContext.POLICY_ID_MDC_KEY, assignment.getPolicyId().toString());
                    try {
                        boolean posted = retrier.execute("payroll_accrual",
                                () -> accrue(payload, entry, assignment, version.get()));
                        if (posted) {
                            accrued++;
                            metrics.recordAccrual("payroll", "accrued");
                        } else {
                            skipped++;
                            metrics.recordAccrual("payroll", "skipped");
                        }
                    } catch (RuntimeException e) {
                        if (StoreFailures.isFatal(e)) {
                            throw e;
                        }
                        errors++;
                        metrics.recordAccrual("payroll", "error");
                        log.error("Payroll accrual failed: run={}, assignmentId={}",
                                payload.getPayrollRunId(), assignment.getId(), e);
                    } finally {
                        MDC.remove(CorrelationContext.POLICY_ID_MDC_KEY);
                    }
                }
            } catch (RuntimeException e) {
                if (StoreFailures.isFatal(e)) {
                    log.error("Aborting payroll run {}: store failure", payload.getPayrollRunId(), e);
                    throw e;
                }
                errors++;
                log.error("Payroll entry failed: run={}, employeeId={}", payload.getPayrollRunId(), entry.getEmployeeId(), e);
            } finally {
                MDC.remove(CorrelationContext.EMPLOYEE_ID_MDC_KEY);
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordLatency("payroll_run", duration);
        log.info("Payroll run processed: run={}, processed={}, accrued={}, skipped={}, errors={}, duration={}ms",
                payload.getPayrollRunId(), processed, accrued, skipped, errors, duration);
        return new PayrollProcessingResult(payload.getPayrollRunId(), processed, accrued, skipped, errors);
    }

    private boolean accrue(PayrollPayload payload, PayrollPayload.Entry entry, Assignment assignment,
                           PolicyVersion version) {
        Optional<AccrualDue> due = engine.payrollAccrualDue(payload, entry, version);
        if (due.isEmpty()) {
            return false;
        }
        BalanceRules rules = version.getSettings().balanceRules();
        BalanceKey key = BalanceKey.of(assignment.getCompanyId(), assignment.getEmployeeId(), assignment.getPolicyId());
        return postingService.post(key, rules, engine.planner(due.get(), rules.getBankCapMinutes()))
            .wroteAnything();
    }
}
