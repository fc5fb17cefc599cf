package com.flagship.pto_ledger.ledger;

import lombok.Value;

/**
 * Outcome of appending one posting: the stored row, and whether this call wrote it.
 */
@Value
public class AppendResult {
    LedgerEntry entry;
    boolean inserted;
}
