package com.flagship.pto_ledger.ledger;

import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.ledger.dto.AdjustmentResponse;
import com.flagship.pto_ledger.ledger.dto.BalanceResponse;
import com.flagship.pto_ledger.ledger.dto.CreateAdjustmentBody;
import com.flagship.pto_ledger.ledger.dto.LedgerEntryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Balances, ledger history and manual adjustments for one employee.
 */
@RestController
@RequestMapping("/api/companies/{companyId}/employees/{employeeId}")
@RequiredArgsConstructor
public class BalanceController {

    private final BalanceService balanceService;
    private final AdjustmentService adjustmentService;
    private final ConflictRetrier retrier;
    private final Clock clock;

    @GetMapping("/balances")
    public List<BalanceResponse> balances(
            @PathVariable("companyId") UUID companyId,
            @PathVariable("employeeId") UUID employeeId,
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate onDate = date != null ? date : LocalDate.now(clock);
        return balanceService.getEmployeeBalances(companyId, employeeId, onDate).stream()
            .map(BalanceResponse::from)
            .toList();
    }

    @GetMapping("/balances/{policyId}")
    public BalanceResponse balance(@PathVariable("companyId") UUID companyId,
                                   @PathVariable("employeeId") UUID employeeId,
                                   @PathVariable("policyId") UUID policyId) {
        return BalanceResponse.from(balanceService.getBalance(companyId, employeeId, policyId));
    }

    @GetMapping("/ledger/{policyId}")
    public List<LedgerEntryResponse> ledger(
            @PathVariable("companyId") UUID companyId,
            @PathVariable("employeeId") UUID employeeId,
            @PathVariable("policyId") UUID policyId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return balanceService.listLedger(companyId, employeeId, policyId, from, to).stream()
            .map(LedgerEntryResponse::from)
            .toList();
    }

    @PostMapping("/balances/{policyId}/rebuild")
    public BalanceResponse rebuild(@PathVariable("companyId") UUID companyId,
                                   @PathVariable("employeeId") UUID employeeId,
                                   @PathVariable("policyId") UUID policyId) {
        return BalanceResponse.from(retrier.execute("snapshot_rebuild",
                () -> balanceService.rebuildSnapshot(companyId, employeeId, policyId)));
    }

    /**
     * Returns 201 for a new entry and 200 when the {@code Idempotency-Key} was already used.
     */
    @PostMapping("/adjustments")
    public ResponseEntity<AdjustmentResponse> adjust(
            @PathVariable("companyId") UUID companyId,
            @PathVariable("employeeId") UUID employeeId,
            @Valid @RequestBody CreateAdjustmentBody body,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId) {
        if (!employeeId.equals(body.getEmployeeId())) {
            throw new ValidationException("employee_id in body does not match path: " + body.getEmployeeId());
        }
        AdjustmentResult result = retrier.execute("adjustment", () -> adjustmentService.createAdjustment(
                companyId, employeeId, body.getPolicyId(), body.getAmountMinutes(), body.getEffectiveDate(),
                body.getReason(), idempotencyKey, actorId));
        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(AdjustmentResponse.from(result));
    }
}
