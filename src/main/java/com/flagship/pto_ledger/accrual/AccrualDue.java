package com.flagship.pto_ledger.accrual;

import com.flagship.pto_ledger.ledger.LedgerSourceType;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * An accrual that is owed, before the bank cap is applied against the locked balance.
 */
@Value
public class AccrualDue {
    LedgerSourceType sourceType;
    String sourceId;
    int amountMinutes;
    Instant effectiveAt;
    UUID policyVersionId;
    Map<String, Object> metadata;
}
