package com.flagship.pto_ledger.policy;

/**
 * How a policy produces balance.
 */
public enum PolicyKind {
    /** No balance is tracked for spending; requests are never refused for lack of time. */
    UNLIMITED,
    /** Accrues a fixed rate per calendar period. */
    TIME_ACCRUAL,
    /** Accrues from payroll-reported worked minutes. */
    HOURS_WORKED_ACCRUAL
}
