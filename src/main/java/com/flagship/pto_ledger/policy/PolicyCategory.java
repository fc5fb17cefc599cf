package com.flagship.pto_ledger.policy;

public enum PolicyCategory {
    VACATION,
    SICK,
    PERSONAL,
    BEREAVEMENT,
    PARENTAL,
    OTHER
}
