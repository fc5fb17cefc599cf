package com.flagship.pto_ledger.policy;

/**
 * Presentation unit only. Every stored amount is whole minutes regardless of this value.
 */
public enum DisplayUnit {
    MINUTES,
    HOURS,
    DAYS
}
