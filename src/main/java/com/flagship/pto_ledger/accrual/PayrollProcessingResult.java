package com.flagship.pto_ledger.accrual;

import lombok.Value;

/**
 * Outcome of one payroll run. A replayed run reports its entries as skipped.
 */
@Value
public class PayrollProcessingResult {
    String payrollRunId;
    int processed;
    int accrued;
    int skipped;
    int errors;
}
