package com.flagship.pto_ledger.exception;

/**
 * A time range whose end is not after its start.
 */
public class InvalidRangeException extends ValidationException {

    public InvalidRangeException(String message) {
        super("INVALID_RANGE", message);
    }
}
