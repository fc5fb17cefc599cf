package com.flagship.pto_ledger.exception;

/**
 * A ledger idempotency key is already taken by an entry with a different intent
 * (another balance key, or an amount of the opposite sign).
 * Replays with identical intent never raise this; they are absorbed as no-ops.
 */
public class DuplicateIdempotencyKeyException extends TimeOffException {

    public DuplicateIdempotencyKeyException(String message) {
        super("DUPLICATE_IDEMPOTENCY_KEY", message);
    }
}
