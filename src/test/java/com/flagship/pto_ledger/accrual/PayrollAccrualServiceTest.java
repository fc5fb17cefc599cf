package com.flagship.pto_ledger.accrual;

import com.flagship.pto_ledger.AbstractIntegrationTest;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.ledger.BalanceService;
import com.flagship.pto_ledger.policy.AccrualRatio;
import com.flagship.pto_ledger.policy.HoursWorkedAccrualSettings;
import com.flagship.pto_ledger.policy.TimeOffPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PayrollAccrualServiceTest extends AbstractIntegrationTest {

    @Autowired
    private PayrollAccrualService payrollAccrualService;

    @Autowired
    private BalanceService balanceService;

    private UUID employeeId;

    @BeforeEach
    void setUp() {
        employeeId = createEmployee(480, "UTC", null);
    }

    private TimeOffPolicy hoursWorkedPolicy(Integer bankCapMinutes) {
        return createPolicy("sick", LocalDate.of(2024, 1, 1), HoursWorkedAccrualSettings.builder()
            .ratio(new AccrualRatio(1, 30))
            .bankCapMinutes(bankCapMinutes)
            .build());
    }

    private PayrollPayload payload(String runId, int workedMinutes) {
        return new PayrollPayload(runId, companyId, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 15),
                List.of(new PayrollPayload.Entry(employeeId, workedMinutes)));
    }

    @Test
    @DisplayName("Worked minutes accrue at the policy ratio, rounded down")
    void accruesAtRatio() {
        printTestHeader("Payroll accrual");
        TimeOffPolicy policy = hoursWorkedPolicy(null);
        assign(employeeId, policy.getId(), LocalDate.of(2024, 1, 1));
        printInput("Worked minutes", 4810);

        PayrollProcessingResult result = payrollAccrualService.processPayroll(payload("run-1", 4810));
        printOutput("Result", result);

        assertEquals(1, result.getProcessed());
        assertEquals(1, result.getAccrued());
        assertEquals(160, balanceService.getBalance(companyId, employeeId, policy.getId()).getAccruedMinutes());
        printSuccess("floor(4810 / 30) = 160");
    }

    @Test
    @DisplayName("A replayed payroll run writes nothing")
    void replayIsSkipped() {
        TimeOffPolicy policy = hoursWorkedPolicy(null);
        assign(employeeId, policy.getId(), LocalDate.of(2024, 1, 1));

        payrollAccrualService.processPayroll(payload("run-1", 4800));
        PayrollProcessingResult replay = payrollAccrualService.processPayroll(payload("run-1", 4800));

        assertEquals(0, replay.getAccrued());
        assertEquals(1, replay.getSkipped());
        assertEquals(1, countLedgerEntries(employeeId, policy.getId()));

        payrollAccrualService.processPayroll(payload("run-2", 4800));
        assertEquals(320, balanceService.getBalance(companyId, employeeId, policy.getId()).getAccruedMinutes());
    }

    @Test
    @DisplayName("Payroll accrual respects the bank cap")
    void capApplies() {
        TimeOffPolicy policy = hoursWorkedPolicy(100);
        assign(employeeId, policy.getId(), LocalDate.of(2024, 1, 1));

        payrollAccrualService.processPayroll(payload("run-1", 4800));

        assertEquals(100, balanceService.getBalance(companyId, employeeId, policy.getId()).getAccruedMinutes());
    }

    @Test
    @DisplayName("Time-based policies are not touched by payroll")
    void timeAccrualPolicyIgnored() {
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 1, 1), monthlyAccrual(480, null, null, null));
        assign(employeeId, policy.getId(), LocalDate.of(2024, 1, 1));

        PayrollProcessingResult result = payrollAccrualService.processPayroll(payload("run-1", 4800));

        assertEquals(0, result.getProcessed());
        assertEquals(0, countLedgerEntries(employeeId, policy.getId()));
    }

    @Test
    @DisplayName("Malformed payloads are rejected before anything is written")
    void malformedPayloadRejected() {
        assertThrows(ValidationException.class, () -> payrollAccrualService.processPayroll(
            new PayrollPayload("run-1", companyId, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 15), List.of())));
        assertThrows(ValidationException.class, () -> payrollAccrualService.processPayroll(
            new PayrollPayload("run-1", companyId, LocalDate.of(2024, 3, 15), LocalDate.of(2024, 3, 1),
                List.of(new PayrollPayload.Entry(employeeId, 60)))));
        assertThrows(ValidationException.class, () -> payrollAccrualService.processPayroll(payload("run-1", 0)));
    }
}
