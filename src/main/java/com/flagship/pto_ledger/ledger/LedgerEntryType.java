package com.flagship.pto_ledger.ledger;

/**
 * Kinds of ledger movement, and the snapshot bucket each one moves.
 *
 * Accrual, adjustment, expiration and carryover move {@code accrued} by their amount.
 * Hold and hold release move {@code held} by the negated amount, usage moves {@code used}
 * by the negated amount. That keeps {@code accrued - used - held} equal to the plain sum of
 * all amounts.
 */
public enum LedgerEntryType {
    ACCRUAL,
    HOLD,
    HOLD_RELEASE,
    USAGE,
    ADJUSTMENT,
    EXPIRATION,
    CARRYOVER
}
