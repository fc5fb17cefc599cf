package com.flagship.pto_ledger.exception;

/**
 * The referenced policy, assignment or request does not exist.
 */
public class NotFoundException extends TimeOffException {

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
