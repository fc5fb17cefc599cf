package com.flagship.pto_ledger.exception;

/**
 * Input failed validation: malformed settings, a bad payload, or a request covering no working time.
 */
public class ValidationException extends TimeOffException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }

    protected ValidationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
