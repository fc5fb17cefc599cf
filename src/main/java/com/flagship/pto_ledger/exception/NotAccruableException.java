package com.flagship.pto_ledger.exception;

/**
 * The policy kind does not accrue (unlimited policies).
 */
public class NotAccruableException extends TimeOffException {

    public NotAccruableException(String message) {
        super("NOT_ACCRUABLE", message);
    }
}
