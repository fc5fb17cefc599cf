package com.flagship.pto_ledger.policy;

/**
 * Whether a period's accrual posts on its first or last day.
 */
public enum AccrualTiming {
    START_OF_PERIOD,
    END_OF_PERIOD
}
