package com.flagship.pto_ledger.exception;

/**
 * A lock could not be acquired in time, or the snapshot changed underneath an update.
 * Safe to retry; see {@code ConflictRetrier}.
 */
public class ConcurrencyConflictException extends TimeOffException {

    public ConcurrencyConflictException(String message) {
        super("CONCURRENCY_CONFLICT", message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super("CONCURRENCY_CONFLICT", message, cause);
    }
}
