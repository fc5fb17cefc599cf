package com.flagship.pto_ledger.ledger;

import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
public class PostingResult {
    List<LedgerEntry> inserted;
    List<LedgerEntry> replayed;
    BalanceSnapshot snapshot;

    public boolean wroteAnything() {
        return !inserted.isEmpty();
    }

    public Optional<LedgerEntry> insertedOfType(LedgerEntryType type) {
        return inserted.stream().filter(e -> e.getEntryType() == type).findFirst();
    }
}
