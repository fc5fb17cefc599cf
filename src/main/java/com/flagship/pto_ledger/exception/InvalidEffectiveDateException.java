package com.flagship.pto_ledger.exception;

/**
 * A new policy version would start before the version it replaces.
 */
public class InvalidEffectiveDateException extends TimeOffException {

    public InvalidEffectiveDateException(String message) {
        super("INVALID_EFFECTIVE_DATE", message);
    }
}
