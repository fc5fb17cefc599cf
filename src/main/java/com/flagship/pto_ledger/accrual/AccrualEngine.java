package com.flagship.pto_ledger.accrual;

import com.flagship.pto_ledger.assignment.Assignment;
import com.flagship.pto_ledger.exception.NotAccruableException;
import com.flagship.pto_ledger.ledger.LedgerEntryType;
import com.flagship.pto_ledger.ledger.LedgerPosting;
import com.flagship.pto_ledger.ledger.LedgerSourceType;
import com.flagship.pto_ledger.ledger.PostingPlanner;
import com.flagship.pto_ledger.policy.HoursWorkedAccrualSettings;
import com.flagship.pto_ledger.policy.PolicyKind;
import com.flagship.pto_ledger.policy.PolicyVersion;
import com.flagship.pto_ledger.policy.TimeAccrualSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides what accrual is owed and turns it into a ledger posting.
 *
 * No I/O: callers resolve the assignment, the policy version and the hire date.
 */
@Component
@RequiredArgsConstructor
public class AccrualEngine {

    private final AccrualCalculator calculator;

    /**
     * The time-based accrual owed on {@code targetDate}, or empty when the date is not a posting
     * day, the policy is not time-based, or the amount rounds to zero.
     *
     * @param hireDate tenure start; the assignment start is used when null
     * @throws NotAccruableException for unlimited policies
     */
    public Optional<AccrualDue> timeAccrualDue(Assignment assignment, PolicyVersion version,
                                               LocalDate hireDate, LocalDate targetDate) {
        rejectUnlimited(version);
        if (!(version.getSettings() instanceof TimeAccrualSettings settings)) {
            return Optional.empty();
        }
        if (!assignment.covers(targetDate) || !calculator.isAccrualDate(targetDate, settings, assignment)) {
            return Optional.empty();
        }

        AccrualPeriod period = AccrualPeriod.containing(targetDate, settings.getFrequency());
        LocalDate tenureStart = hireDate != null ? hireDate : assignment.getEffectiveFrom();
        long tenureMonths = calculator.tenureMonths(tenureStart, targetDate);
        int rate = calculator.ratePerPeriod(settings, tenureMonths);
        long activeDays = calculator.activeDays(period, assignment);
        int amount = calculator.prorate(rate, activeDays, period.lengthInDays(), settings.getProration());
        if (amount <= 0) {
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("period", period.key());
        metadata.put("rateMinutes", rate);
        metadata.put("activeDays", activeDays);
        metadata.put("periodDays", period.lengthInDays());
        metadata.put("tenureMonths", tenureMonths);

        return Optional.of(new AccrualDue(
            LedgerSourceType.SYSTEM,
            "accrual:" + assignment.getId() + ":" + period.key(),
            amount,
            targetDate.atStartOfDay(ZoneOffset.UTC).toInstant(),
            version.getId(),
            metadata
        ));
    }

    /**
     * The accrual one payroll entry earns, or empty when it rounds to zero.
     *
     * @throws NotAccruableException for unlimited policies
     */
    public Optional<AccrualDue> payrollAccrualDue(PayrollPayload payload, PayrollPayload.Entry entry,
                                                  PolicyVersion version) {
        rejectUnlimited(version);
        if (!(version.getSettings() instanceof HoursWorkedAccrualSettings settings)) {
            return Optional.empty();
        }
        int amount = calculator.hoursWorkedAccrual(entry.getWorkedMinutes(), settings.getRatio());
        if (amount <= 0) {
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("payrollRunId", payload.getPayrollRunId());
        metadata.put("workedMinutes", entry.getWorkedMinutes());
        metadata.put("periodStart", payload.getPeriodStart().toString());
        metadata.put("periodEnd", payload.getPeriodEnd().toString());

        return Optional.of(new AccrualDue(
            LedgerSourceType.PAYROLL,
            "payroll:" + payload.getPayrollRunId() + ":" + entry.getEmployeeId() + ":" + version.getPolicyId(),
            amount,
            payload.getPeriodEnd().atStartOfDay(ZoneOffset.UTC).toInstant(),
            version.getId(),
            metadata
        ));
    }

    /**
     * Plans the ACCRUAL posting against the locked balance, clamped to the bank cap.
     * Plans nothing when the balance is already at the cap.
     */
    public PostingPlanner planner(AccrualDue due, Long bankCapMinutes) {
        return locked -> {
            int amount = calculator.clampToCap(due.getAmountMinutes(), locked.getAccruedMinutes(), bankCapMinutes);
            if (amount <= 0) {
                return List.of();
            }
            Map<String, Object> metadata = new LinkedHashMap<>(due.getMetadata());
            metadata.put("computedMinutes", due.getAmountMinutes());
            if (amount < due.getAmountMinutes()) {
                metadata.put("cappedAt", bankCapMinutes);
            }
            return List.of(LedgerPosting.builder()
                .entryType(LedgerEntryType.ACCRUAL)
                .amountMinutes(amount)
                .sourceType(due.getSourceType())
                .sourceId(due.getSourceId())
                .effectiveAt(due.getEffectiveAt())
                .policyVersionId(due.getPolicyVersionId())
                .metadata(metadata)
                .build());
        };
    }

    private static void rejectUnlimited(PolicyVersion version) {
        if (version.getKind() == PolicyKind.UNLIMITED) {
            throw new NotAccruableException("Policy " + version.getPolicyId() + " is unlimited and does not accrue");
        }
    }
}
