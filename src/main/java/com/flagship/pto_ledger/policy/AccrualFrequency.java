package com.flagship.pto_ledger.policy;

public enum AccrualFrequency {
    DAILY,
    MONTHLY,
    YEARLY
}
