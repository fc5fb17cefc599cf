package com.flagship.pto_ledger.exception;

/**
 * A time-off request asks for more minutes than the employee can spend.
 */
public class InsufficientBalanceException extends BalanceInvariantViolatedException {

    public InsufficientBalanceException(long availableMinutes, long requestedMinutes) {
        super("INSUFFICIENT_BALANCE",
                String.format("Insufficient balance: available=%d, requested=%d", availableMinutes, requestedMinutes),
                availableMinutes, requestedMinutes);
    }
}
