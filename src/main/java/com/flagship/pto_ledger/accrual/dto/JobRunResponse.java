package com.flagship.pto_ledger.accrual.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.accrual.AccrualRunResult;
import com.flagship.pto_ledger.accrual.PayrollProcessingResult;
import com.flagship.pto_ledger.carryover.YearEndRunResult;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Summary of a batch run. Counters that do not apply to the job are omitted.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobRunResponse {

    @JsonProperty("job")
    String job;

    @JsonProperty("target_date")
    LocalDate targetDate;

    @JsonProperty("payroll_run_id")
    String payrollRunId;

    @JsonProperty("processed")
    int processed;

    @JsonProperty("accrued")
    Integer accrued;

    @JsonProperty("carryovers")
    Integer carryovers;

    @JsonProperty("expirations")
    Integer expirations;

    @JsonProperty("skipped")
    int skipped;

    @JsonProperty("errors")
    int errors;

    public static JobRunResponse from(AccrualRunResult result) {
        return JobRunResponse.builder()
            .job("accruals")
            .targetDate(result.getTargetDate())
            .processed(result.getProcessed())
            .accrued(result.getAccrued())
            .skipped(result.getSkipped())
            .errors(result.getErrors())
            .build();
    }

    public static JobRunResponse from(PayrollProcessingResult result) {
        return JobRunResponse.builder()
            .job("payroll")
            .payrollRunId(result.getPayrollRunId())
            .processed(result.getProcessed())
            .accrued(result.getAccrued())
            .skipped(result.getSkipped())
            .errors(result.getErrors())
            .build();
    }

    public static JobRunResponse from(String job, YearEndRunResult result) {
        return JobRunResponse.builder()
            .job(job)
            .targetDate(result.getTargetDate())
            .processed(result.getProcessed())
            .carryovers(result.getCarryovers())
            .expirations(result.getExpirations())
            .skipped(result.getSkipped())
            .errors(result.getErrors())
            .build();
    }
}
