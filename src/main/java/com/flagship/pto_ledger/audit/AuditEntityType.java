package com.flagship.pto_ledger.audit;

/**
 * What an audit entry is about. Ledger rows are classified by what wrote them.
 */
public enum AuditEntityType {
    POLICY,
    POLICY_VERSION,
    ASSIGNMENT,
    REQUEST,
    REQUEST_POSTING,
    ACCRUAL,
    ADJUSTMENT,
    YEAR_END
}
