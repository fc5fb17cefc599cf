package com.flagship.pto_ledger.report;

import com.flagship.pto_ledger.audit.AuditAction;
import com.flagship.pto_ledger.audit.AuditEntityType;
import com.flagship.pto_ledger.audit.AuditQuery;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.report.dto.AuditEntryResponse;
import com.flagship.pto_ledger.report.dto.BalanceSummaryResponse;
import com.flagship.pto_ledger.report.dto.LedgerExportEntryResponse;
import com.flagship.pto_ledger.report.dto.PageResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Read-only company reports. Pages are zero-based; {@code size} is capped at 100.
 */
@RestController
@RequestMapping("/api/companies/{companyId}")
@RequiredArgsConstructor
public class ReportController {

    private static final int MAX_PAGE_SIZE = 100;

    private final ReportService reportService;
    private final Clock clock;

    @GetMapping("/reports/balances")
    public BalanceSummaryResponse balances(
            @PathVariable("companyId") UUID companyId,
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate onDate = date != null ? date : LocalDate.now(clock);
        return BalanceSummaryResponse.of(onDate, reportService.balanceSummary(companyId, onDate));
    }

    @GetMapping("/reports/ledger")
    public PageResponse<LedgerExportEntryResponse> ledger(
            @PathVariable("companyId") UUID companyId,
            @RequestParam(value = "employeeId", required = false) UUID employeeId,
            @RequestParam(value = "policyId", required = false) UUID policyId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "50") int size) {
        return PageResponse.from(
            reportService.exportLedger(companyId, employeeId, policyId, from, to, pageRequest(page, size)),
            LedgerExportEntryResponse::from);
    }

    @GetMapping("/audit-log")
    public PageResponse<AuditEntryResponse> auditLog(
            @PathVariable("companyId") UUID companyId,
            @RequestParam(value = "entityType", required = false) AuditEntityType entityType,
            @RequestParam(value = "entityId", required = false) UUID entityId,
            @RequestParam(value = "action", required = false) AuditAction action,
            @RequestParam(value = "actorId", required = false) UUID actorId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "50") int size) {
        AuditQuery query = AuditQuery.builder()
            .companyId(companyId)
            .entityType(entityType)
            .entityId(entityId)
            .action(action)
            .actorId(actorId)
            .from(from)
            .to(to)
            .build();
        return PageResponse.from(reportService.auditLog(query, pageRequest(page, size)), AuditEntryResponse::from);
    }

    private static PageRequest pageRequest(int page, int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException(String.format(
                "page must be >= 0 and size between 1 and %d: page=%d, size=%d", MAX_PAGE_SIZE, page, size));
        }
        return PageRequest.of(page, size);
    }
}
