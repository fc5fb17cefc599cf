package com.flagship.pto_ledger.policy;

public enum ProrationMethod {
    /** Scale the period rate by the share of the period the assignment was active. */
    DAYS_ACTIVE,
    NONE
}
