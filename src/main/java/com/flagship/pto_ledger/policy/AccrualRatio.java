package com.flagship.pto_ledger.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.exception.ValidationException;
import lombok.Value;

/**
 * Earn {@code accrueMinutes} for every {@code perWorkedMinutes} worked.
 */
@Value
public class AccrualRatio {
    int accrueMinutes;
    int perWorkedMinutes;

    @JsonCreator
    public AccrualRatio(@JsonProperty("accrueMinutes") int accrueMinutes,
                        @JsonProperty("perWorkedMinutes") int perWorkedMinutes) {
        if (accrueMinutes <= 0 || perWorkedMinutes <= 0) {
            throw new ValidationException(String.format(
                    "Accrual ratio terms must be positive: accrueMinutes=%d, perWorkedMinutes=%d",
                    accrueMinutes, perWorkedMinutes));
        }
        this.accrueMinutes = accrueMinutes;
        this.perWorkedMinutes = perWorkedMinutes;
    }
}
