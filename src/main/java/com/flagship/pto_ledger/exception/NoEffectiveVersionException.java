package com.flagship.pto_ledger.exception;

/**
 * No policy version covers the requested date.
 */
public class NoEffectiveVersionException extends TimeOffException {

    public NoEffectiveVersionException(String message) {
        super("NO_EFFECTIVE_VERSION", message);
    }
}
