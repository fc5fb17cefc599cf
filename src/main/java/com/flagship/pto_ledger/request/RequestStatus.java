package com.flagship.pto_ledger.request;

/**
 * Lifecycle of a time-off request.
 *
 * DRAFT → SUBMITTED → APPROVED | DENIED, and DRAFT | SUBMITTED → CANCELLED.
 */
public enum RequestStatus {
    /**
     * Saved but not yet asking for time. Holds nothing.
     */
    DRAFT,

    /**
     * Awaiting a decision. The requested minutes are held against the balance.
     */
    SUBMITTED,

    /**
     * Terminal. The hold has been converted to usage.
     */
    APPROVED,

    /**
     * Terminal. The hold has been released.
     */
    DENIED,

    /**
     * Terminal. Any hold has been released.
     */
    CANCELLED
}
