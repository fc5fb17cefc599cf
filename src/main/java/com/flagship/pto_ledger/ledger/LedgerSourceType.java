package com.flagship.pto_ledger.ledger;

/**
 * What caused a ledger entry. Part of the idempotency key.
 */
public enum LedgerSourceType {
    REQUEST,
    PAYROLL,
    ADMIN,
    SYSTEM
}
