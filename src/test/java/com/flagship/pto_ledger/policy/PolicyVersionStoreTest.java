package com.flagship.pto_ledger.policy;

import com.flagship.pto_ledger.AbstractIntegrationTest;
import com.flagship.pto_ledger.accrual.AccrualService;
import com.flagship.pto_ledger.exception.InvalidEffectiveDateException;
import com.flagship.pto_ledger.exception.NoEffectiveVersionException;
import com.flagship.pto_ledger.ledger.BalanceService;
import com.flagship.pto_ledger.ledger.LedgerEntry;
import com.flagship.pto_ledger.ledger.LedgerEntryType;
import com.flagship.pto_ledger.request.NewTimeOffRequest;
import com.flagship.pto_ledger.request.TimeOffRequestService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PolicyVersionStoreTest extends AbstractIntegrationTest {

    @Autowired
    private PolicyVersionStore versionStore;

    @Autowired
    private AccrualService accrualService;

    @Autowired
    private TimeOffRequestService requestService;

    @Autowired
    private BalanceService balanceService;

    private NewPolicyVersion monthlyFrom(LocalDate from, int rate) {
        return NewPolicyVersion.builder()
            .effectiveFrom(from)
            .displayUnit(DisplayUnit.DAYS)
            .settings(monthlyAccrual(rate, null, null, null))
            .build();
    }

    @Test
    @DisplayName("A new version closes the previous one at its start date")
    void newVersionClosesPrevious() {
        printTestHeader("Policy versioning");
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 1, 1), monthlyAccrual(800, null, null, null));

        PolicyVersion second = versionStore.create(policy.getId(), monthlyFrom(LocalDate.of(2024, 7, 1), 1000));
        List<PolicyVersion> versions = versionStore.listVersions(policy.getId());
        printOutput("Versions", versions);

        assertEquals(2, second.getVersion());
        assertEquals(2, versions.size());
        PolicyVersion first = versions.get(1);
        assertEquals(1, first.getVersion());
        assertEquals(LocalDate.of(2024, 7, 1), first.getEffectiveTo());
        assertNull(second.getEffectiveTo());
        printSuccess("Version 1 closed at the start of version 2");
    }

    @Test
    @DisplayName("Resolution picks the version covering the date, half-open at the boundary")
    void resolvesByDate() {
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 1, 1), monthlyAccrual(800, null, null, null));
        versionStore.create(policy.getId(), monthlyFrom(LocalDate.of(2024, 7, 1), 1000));

        assertEquals(1, versionStore.resolveEffective(policy.getId(), LocalDate.of(2024, 6, 30)).getVersion());
        assertEquals(2, versionStore.resolveEffective(policy.getId(), LocalDate.of(2024, 7, 1)).getVersion());
        assertEquals(2, versionStore.resolveEffective(policy.getId(), LocalDate.of(2030, 1, 1)).getVersion());
        assertThrows(NoEffectiveVersionException.class,
            () -> versionStore.resolveEffective(policy.getId(), LocalDate.of(2023, 12, 31)));
        assertTrue(versionStore.findEffective(policy.getId(), LocalDate.of(2023, 12, 31)).isEmpty());
    }

    @Test
    @DisplayName("A version may not start before the current one")
    void rejectsBackdatedVersion() {
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 3, 1), monthlyAccrual(800, null, null, null));

        assertThrows(InvalidEffectiveDateException.class,
            () -> versionStore.create(policy.getId(), monthlyFrom(LocalDate.of(2024, 2, 1), 1000)));
        assertEquals(1, versionStore.listVersions(policy.getId()).size());
    }

    @Test
    @DisplayName("Stored settings read back as the same variant")
    void settingsRoundTripThroughDatabase() {
        TimeAccrualSettings settings = monthlyAccrual(800, 15_000,
            new CarryoverSettings(true, 2400, 90, null, null), null);
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 1, 1), settings);

        PolicyVersion current = versionStore.current(policy.getId());

        assertEquals(PolicyKind.TIME_ACCRUAL, current.getKind());
        assertEquals(settings, current.getSettings());
    }

    @Test
    @DisplayName("Entries posted under version 1 keep its id after version 2 is created")
    void postedEntriesKeepTheirVersion() {
        printTestHeader("Ledger entries pin the version they were posted under");
        UUID employeeId = createEmployee(480, "UTC", null);
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 1, 1), monthlyAccrual(960, null, null, null));
        assign(employeeId, policy.getId(), LocalDate.of(2024, 1, 1));
        PolicyVersion v1 = versionStore.current(policy.getId());

        accrualService.runAccruals(LocalDate.of(2024, 6, 1), companyId);
        requestService.submitRequest(NewTimeOffRequest.builder()
            .companyId(companyId)
            .employeeId(employeeId)
            .policyId(policy.getId())
            .startAt(Instant.parse("2024-06-10T09:00:00Z"))
            .endAt(Instant.parse("2024-06-10T17:00:00Z"))
            .build());

        PolicyVersion v2 = versionStore.create(policy.getId(), monthlyFrom(LocalDate.of(2025, 1, 1), 1200));
        List<LedgerEntry> entries = balanceService.listLedger(companyId, employeeId, policy.getId(), null, null);
        printOutput("Entries", entries);

        assertNotEquals(v1.getId(), v2.getId());
        assertEquals(2, entries.size());
        assertTrue(entries.stream().anyMatch(e -> e.getEntryType() == LedgerEntryType.ACCRUAL));
        assertTrue(entries.stream().anyMatch(e -> e.getEntryType() == LedgerEntryType.HOLD));
        assertTrue(entries.stream().allMatch(e -> v1.getId().equals(e.getPolicyVersionId())));
        assertEquals(v1.getId(), versionStore.resolveEffective(policy.getId(), LocalDate.of(2024, 6, 15)).getId());
        printSuccess("Both June 2024 entries still reference version 1");
    }
}
