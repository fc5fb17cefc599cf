package com.flagship.pto_ledger.event;

import com.flagship.pto_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an administrator posts a manual adjustment. The aggregate is the ledger entry.
 */
@Value
public class BalanceAdjustedEvent implements TimeOffEvent {
    UUID eventId;
    UUID ledgerEntryId;
    UUID companyId;
    UUID employeeId;
    UUID policyId;
    int amountMinutes;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BalanceAdjusted";

    @Override
    public UUID getAggregateId() {
        return ledgerEntryId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BalanceAdjustedEvent fromEntry(LedgerEntry entry, String reason) {
        return new BalanceAdjustedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getCompanyId(),
            entry.getEmployeeId(),
            entry.getPolicyId(),
            entry.getAmountMinutes(),
            reason,
            Instant.now()
        );
    }
}
