package com.flagship.pto_ledger.ledger;

import com.flagship.pto_ledger.assignment.AssignmentService;
import com.flagship.pto_ledger.policy.PolicyService;
import com.flagship.pto_ledger.policy.PolicyVersion;
import com.flagship.pto_ledger.policy.PolicyVersionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the ledger, plus snapshot rebuilds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceService {

    private final BalanceProjector projector;
    private final LedgerStore ledgerStore;
    private final PolicyService policyService;
    private final PolicyVersionStore versionStore;
    private final AssignmentService assignmentService;
    private final Clock clock;

    /**
     * Current balance. A key that was never written reads as the (empty) ledger fold.
     */
    @Transactional(readOnly = true)
    public BalanceView getBalance(UUID companyId, UUID employeeId, UUID policyId) {
        policyService.getPolicy(companyId, policyId);
        BalanceKey key = BalanceKey.of(companyId, employeeId, policyId);
        BalanceSnapshot snapshot = projector.find(key).orElseGet(() -> ledgerStore.fold(key));
        return BalanceView.of(snapshot, presentationVersion(policyId));
    }

    /**
     * Balances for every policy the employee is assigned to on {@code onDate}.
     */
    @Transactional(readOnly = true)
    public List<BalanceView> getEmployeeBalances(UUID companyId, UUID employeeId, LocalDate onDate) {
        return assignmentService.findActiveAssignments(companyId, employeeId, onDate).stream()
            .map(a -> getBalance(companyId, employeeId, a.getPolicyId()))
            .toList();
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> listLedger(UUID companyId, UUID employeeId, UUID policyId, Instant from, Instant to) {
        policyService.getPolicy(companyId, policyId);
        return ledgerStore.listLedger(BalanceKey.of(companyId, employeeId, policyId), from, to);
    }

    /**
     * Discards the cached snapshot and re-folds it from the ledger, under the balance lock.
     */
    @Transactional
    public BalanceView rebuildSnapshot(UUID companyId, UUID employeeId, UUID policyId) {
        policyService.getPolicy(companyId, policyId);
        BalanceSnapshot rebuilt = projector.rebuild(BalanceKey.of(companyId, employeeId, policyId));
        log.info("Rebuilt balance snapshot: employeeId={}, policyId={}, version={}",
                employeeId, policyId, rebuilt.getVersion());
        return BalanceView.of(rebuilt, presentationVersion(policyId));
    }

    private PolicyVersion presentationVersion(UUID policyId) {
        return versionStore.findEffective(policyId, LocalDate.now(clock))
            .orElseGet(() -> versionStore.current(policyId));
    }
}
