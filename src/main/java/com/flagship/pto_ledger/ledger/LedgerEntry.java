package com.flagship.pto_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A stored, immutable ledger row. Amounts are signed whole minutes.
 *
 * {@code (sourceType, sourceId, entryType)} is unique across the ledger; a replay of the same
 * business event maps to the same key and is absorbed instead of double-posting.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID companyId;
    UUID employeeId;
    UUID policyId;
    UUID policyVersionId;
    LedgerEntryType entryType;
    int amountMinutes;
    Instant effectiveAt;
    LedgerSourceType sourceType;
    String sourceId;
    Map<String, Object> metadata;
    Instant createdAt;
    Long sequenceNumber;

    public BalanceKey balanceKey() {
        return BalanceKey.of(companyId, employeeId, policyId);
    }
}
