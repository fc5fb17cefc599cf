package com.flagship.pto_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Cached fold of the ledger for one balance key.
 *
 * {@code version} increases by one on every write; updates are conditional on it.
 */
@Value
public class BalanceSnapshot {
    BalanceKey key;
    long accruedMinutes;
    long usedMinutes;
    long heldMinutes;
    long version;
    Instant updatedAt;

    public static BalanceSnapshot empty(BalanceKey key) {
        return new BalanceSnapshot(key, 0, 0, 0, 0, null);
    }

    /**
     * {@code accrued - used - held}. Meaningless for unlimited policies; callers decide.
     */
    public long availableMinutes() {
        return accruedMinutes - usedMinutes - heldMinutes;
    }

    public BalanceSnapshot apply(LedgerEntryType type, int amountMinutes) {
        return switch (type) {
            case ACCRUAL, ADJUSTMENT, EXPIRATION, CARRYOVER ->
                new BalanceSnapshot(key, accruedMinutes + amountMinutes, usedMinutes, heldMinutes, version, updatedAt);
            case HOLD, HOLD_RELEASE ->
                new BalanceSnapshot(key, accruedMinutes, usedMinutes, heldMinutes - amountMinutes, version, updatedAt);
            case USAGE ->
                new BalanceSnapshot(key, accruedMinutes, usedMinutes - amountMinutes, heldMinutes, version, updatedAt);
        };
    }

    public BalanceSnapshot applyPostings(List<LedgerPosting> postings) {
        BalanceSnapshot result = this;
        for (LedgerPosting posting : postings) {
            result = result.apply(posting.getEntryType(), posting.getAmountMinutes());
        }
        return result;
    }

    public BalanceSnapshot applyEntries(List<LedgerEntry> entries) {
        BalanceSnapshot result = this;
        for (LedgerEntry entry : entries) {
            result = result.apply(entry.getEntryType(), entry.getAmountMinutes());
        }
        return result;
    }

    public boolean hasSameBucketsAs(BalanceSnapshot other) {
        return accruedMinutes == other.accruedMinutes
            && usedMinutes == other.usedMinutes
            && heldMinutes == other.heldMinutes;
    }
}
