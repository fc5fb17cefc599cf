package com.flagship.pto_ledger.exception;

/**
 * Base type for every domain failure raised by the PTO ledger.
 *
 * Each subtype carries a stable error code that the REST layer returns to clients,
 * so callers can branch on the code rather than on the message text.
 */
public abstract class TimeOffException extends RuntimeException {

    private final String errorCode;

    protected TimeOffException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected TimeOffException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
