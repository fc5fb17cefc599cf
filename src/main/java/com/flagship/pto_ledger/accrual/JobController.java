package com.flagship.pto_ledger.accrual;

import com.flagship.pto_ledger.accrual.dto.JobRunResponse;
import com.flagship.pto_ledger.carryover.CarryoverService;
import com.flagship.pto_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Manual triggers for the date-driven jobs and the payroll webhook. Every trigger is safe to
 * repeat for the same date or payroll run.
 */
@RestController
@RequestMapping("/api/companies/{companyId}")
@RequiredArgsConstructor
public class JobController {

    private final AccrualService accrualService;
    private final PayrollAccrualService payrollAccrualService;
    private final CarryoverService carryoverService;
    private final Clock clock;

    @PostMapping("/jobs/accruals")
    public JobRunResponse runAccruals(
            @PathVariable("companyId") UUID companyId,
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return JobRunResponse.from(accrualService.runAccruals(orToday(date), companyId));
    }

    @PostMapping("/jobs/carryover")
    public JobRunResponse runCarryover(
            @PathVariable("companyId") UUID companyId,
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return JobRunResponse.from("carryover", carryoverService.runCarryover(orToday(date), companyId));
    }

    @PostMapping("/jobs/expiration")
    public JobRunResponse runExpiration(
            @PathVariable("companyId") UUID companyId,
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return JobRunResponse.from("expiration", carryoverService.runExpiration(orToday(date), companyId));
    }

    @PostMapping("/payroll-runs")
    public JobRunResponse processPayroll(@PathVariable("companyId") UUID companyId,
                                         @RequestBody PayrollPayload payload) {
        if (payload.getCompanyId() != null && !payload.getCompanyId().equals(companyId)) {
            throw new ValidationException("company_id in payload does not match path: " + payload.getCompanyId());
        }
        return JobRunResponse.from(payrollAccrualService.processPayroll(payload));
    }

    private LocalDate orToday(LocalDate date) {
        return date != null ? date : LocalDate.now(clock);
    }
}
