package com.flagship.pto_ledger.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;

/**
 * Classifies failures inside batch runs.
 */
public final class StoreFailures {

    private StoreFailures() {
    }

    /**
     * Store unavailable or schema out of step with the code. Retrying the next item cannot help,
     * so batch runs stop on these.
     */
    public static boolean isFatal(Throwable e) {
        return e instanceof DataAccessResourceFailureException
            || e instanceof InvalidDataAccessResourceUsageException;
    }
}
