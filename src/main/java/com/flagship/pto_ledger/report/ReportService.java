package com.flagship.pto_ledger.report;

import com.flagship.pto_ledger.assignment.Assignment;
import com.flagship.pto_ledger.assignment.AssignmentService;
import com.flagship.pto_ledger.audit.AuditEntry;
import com.flagship.pto_ledger.audit.AuditQuery;
import com.flagship.pto_ledger.audit.AuditService;
import com.flagship.pto_ledger.ledger.BalanceService;
import com.flagship.pto_ledger.ledger.LedgerEntry;
import com.flagship.pto_ledger.ledger.LedgerStore;
import com.flagship.pto_ledger.policy.PolicyService;
import com.flagship.pto_ledger.policy.TimeOffPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only company reports: balances across employees, ledger export and the audit log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    private final AssignmentService assignmentService;
    private final PolicyService policyService;
    private final BalanceService balanceService;
    private final LedgerStore ledgerStore;
    private final AuditService auditService;

    /**
     * Current balance of every assignment active on {@code onDate}, ordered by employee then policy.
     */
    @Transactional(readOnly = true)
    public List<EmployeeBalanceSummary> balanceSummary(UUID companyId, LocalDate onDate) {
        List<Assignment> assignments = assignmentService.findActiveAssignments(onDate, companyId);
        Map<UUID, TimeOffPolicy> policies = new HashMap<>();
        List<EmployeeBalanceSummary> rows = assignments.stream()
            .map(a -> {
                TimeOffPolicy policy = policies.computeIfAbsent(a.getPolicyId(),
                        id -> policyService.getPolicy(companyId, id));
                return new EmployeeBalanceSummary(policy.getKey(), policy.getCategory(),
                        balanceService.getBalance(companyId, a.getEmployeeId(), a.getPolicyId()));
            })
            .toList();
        log.debug("Balance summary: companyId={}, onDate={}, rows={}", companyId, onDate, rows.size());
        return rows;
    }

    @Transactional(readOnly = true)
    public Page<LedgerEntry> exportLedger(UUID companyId, UUID employeeId, UUID policyId,
                                          Instant from, Instant to, Pageable pageable) {
        return ledgerStore.exportLedger(companyId, employeeId, policyId, from, to, pageable);
    }

    @Transactional(readOnly = true)
    public Page<AuditEntry> auditLog(AuditQuery query, Pageable pageable) {
        return auditService.queryAuditLog(query, pageable);
    }
}
