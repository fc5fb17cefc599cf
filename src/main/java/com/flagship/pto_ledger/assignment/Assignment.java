package com.flagship.pto_ledger.assignment;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Binds an employee to a policy over {@code [effectiveFrom, effectiveTo)}.
 */
@Value
public class Assignment {
    UUID id;
    UUID companyId;
    UUID employeeId;
    UUID policyId;
    LocalDate effectiveFrom;
    LocalDate effectiveTo;
    UUID createdBy;
    Instant createdAt;

    public static Assignment create(UUID companyId, UUID employeeId, UUID policyId,
                                    LocalDate effectiveFrom, LocalDate effectiveTo, UUID createdBy,
                                    Instant createdAt) {
        return new Assignment(UUID.randomUUID(), companyId, employeeId, policyId,
                effectiveFrom, effectiveTo, createdBy, createdAt);
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(effectiveFrom) && (effectiveTo == null || date.isBefore(effectiveTo));
    }

    public boolean overlaps(LocalDate from, LocalDate to) {
        boolean startsBeforeOtherEnds = to == null || effectiveFrom.isBefore(to);
        boolean endsAfterOtherStarts = effectiveTo == null || effectiveTo.isAfter(from);
        return startsBeforeOtherEnds && endsAfterOtherStarts;
    }
}
