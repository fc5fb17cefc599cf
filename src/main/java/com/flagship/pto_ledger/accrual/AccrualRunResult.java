package com.flagship.pto_ledger.accrual;

import lombok.Value;

import java.time.LocalDate;

@Value
public class AccrualRunResult {
    LocalDate targetDate;
    int processed;
    int accrued;
    int skipped;
    int errors;
}
