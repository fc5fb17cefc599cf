package com.flagship.pto_ledger.exception;

/**
 * A ledger write would push the available balance below what the policy permits.
 * Raised before any ledger row is written, so the enclosing transaction rolls back cleanly.
 */
public class BalanceInvariantViolatedException extends TimeOffException {

    private final long availableMinutes;
    private final long requiredMinutes;

    public BalanceInvariantViolatedException(String message, long availableMinutes, long requiredMinutes) {
        this("BALANCE_INVARIANT_VIOLATED", message, availableMinutes, requiredMinutes);
    }

    protected BalanceInvariantViolatedException(String errorCode, String message,
                                                long availableMinutes, long requiredMinutes) {
        super(errorCode, message);
        this.availableMinutes = availableMinutes;
        this.requiredMinutes = requiredMinutes;
    }

    public long getAvailableMinutes() {
        return availableMinutes;
    }

    public long getRequiredMinutes() {
        return requiredMinutes;
    }
}
