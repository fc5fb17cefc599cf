package com.flagship.pto_ledger.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.exception.ValidationException;
import lombok.Value;

/**
 * Replacement accrual rate once an employee has at least {@code minMonths} of tenure.
 */
@Value
public class TenureTier {
    int minMonths;
    int rateMinutes;

    @JsonCreator
    public TenureTier(@JsonProperty("minMonths") int minMonths,
                      @JsonProperty("rateMinutes") int rateMinutes) {
        if (minMonths < 0) {
            throw new ValidationException("Tenure tier minMonths must be >= 0, got " + minMonths);
        }
        if (rateMinutes <= 0) {
            throw new ValidationException("Tenure tier rateMinutes must be > 0, got " + rateMinutes);
        }
        this.minMonths = minMonths;
        this.rateMinutes = rateMinutes;
    }
}
