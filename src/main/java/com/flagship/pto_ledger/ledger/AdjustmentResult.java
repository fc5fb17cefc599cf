package com.flagship.pto_ledger.ledger;

import lombok.Value;

@Value
public class AdjustmentResult {
    LedgerEntry entry;
    boolean replayed;
    BalanceView balance;
}
