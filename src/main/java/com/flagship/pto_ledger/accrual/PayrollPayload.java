package com.flagship.pto_ledger.accrual;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.exception.ValidationException;
import lombok.Value;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A processed payroll run, as delivered by the payroll webhook or the payroll topic.
 * {@code payrollRunId} anchors idempotency: the same run never accrues twice.
 */
@Value
public class PayrollPayload {

    @JsonProperty("payroll_run_id")
    String payrollRunId;

    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("period_start")
    LocalDate periodStart;

    @JsonProperty("period_end")
    LocalDate periodEnd;

    @JsonProperty("entries")
    List<Entry> entries;

    @Value
    public static class Entry {

        @JsonProperty("employee_id")
        UUID employeeId;

        @JsonProperty("worked_minutes")
        int workedMinutes;
    }

    /**
     * @throws ValidationException on a malformed payload
     */
    public void validate() {
        if (payrollRunId == null || payrollRunId.isBlank()) {
            throw new ValidationException("Payroll payload requires payroll_run_id");
        }
        if (companyId == null || periodStart == null || periodEnd == null) {
            throw new ValidationException("Payroll payload requires company_id, period_start and period_end");
        }
        if (periodEnd.isBefore(periodStart)) {
            throw new ValidationException(String.format(
                "Payroll period_end %s precedes period_start %s", periodEnd, periodStart));
        }
        if (entries == null || entries.isEmpty()) {
            throw new ValidationException("Payroll payload has no entries");
        }
        Set<UUID> seen = new HashSet<>();
        for (Entry entry : entries) {
            if (entry == null || entry.getEmployeeId() == null) {
                throw new ValidationException("Payroll entry requires employee_id");
            }
            if (entry.getWorkedMinutes() <= 0) {
                throw new ValidationException(String.format(
                    "Payroll entry for %s has non-positive worked_minutes %d",
                    entry.getEmployeeId(), entry.getWorkedMinutes()));
            }
            if (!seen.add(entry.getEmployeeId())) {
                throw new ValidationException("Payroll payload lists employee twice: " + entry.getEmployeeId());
            }
        }
    }
}
