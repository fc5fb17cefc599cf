package com.flagship.pto_ledger.exception;

/**
 * A request transition was attempted from a state that does not allow it.
 */
public class InvalidTransitionException extends TimeOffException {

    public InvalidTransitionException(String message) {
        super("INVALID_TRANSITION", message);
    }
}
