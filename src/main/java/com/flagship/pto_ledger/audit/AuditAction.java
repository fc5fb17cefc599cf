package com.flagship.pto_ledger.audit;

public enum AuditAction {
    CREATE,
    UPDATE,
    SUBMIT,
    APPROVE,
    DENY,
    CANCEL
}
