package com.flagship.pto_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A ledger entry proposed for one balance, not yet written. Null metadata is stored as {@code {}}.
 */
@Value
@Builder(toBuilder = true)
public class LedgerPosting {
    LedgerEntryType entryType;
    int amountMinutes;
    LedgerSourceType sourceType;
    String sourceId;
    Instant effectiveAt;
    UUID policyVersionId;
    Map<String, Object> metadata;
}
