package com.flagship.pto_ledger.carryover;

import lombok.Value;

import java.time.LocalDate;

/**
 * Outcome of a carryover or expiration run. {@code carryovers} counts balances rolled over,
 * {@code expirations} counts EXPIRATION entries written.
 */
@Value
public class YearEndRunResult {
    LocalDate targetDate;
    int processed;
    int carryovers;
    int expirations;
    int skipped;
    int errors;
}
