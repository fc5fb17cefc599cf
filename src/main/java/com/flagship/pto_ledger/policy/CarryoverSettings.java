package com.flagship.pto_ledger.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.DateTimeException;
import java.time.MonthDay;

/**
 * Year-end rollover rules.
 *
 * At the boundary (January 1 unless configured) the unused balance is carried forward up to
 * {@code capMinutes}; a null cap carries everything. When {@code expiresAfterDays} is set,
 * whatever is left of the carried amount that many days after the boundary expires.
 */
@Value
public class CarryoverSettings {
    boolean enabled;
    Integer capMinutes;
    Integer expiresAfterDays;
    int boundaryMonth;
    int boundaryDay;

    @Builder
    @JsonCreator
    public CarryoverSettings(@JsonProperty("enabled") boolean enabled,
                             @JsonProperty("capMinutes") Integer capMinutes,
                             @JsonProperty("expiresAfterDays") Integer expiresAfterDays,
                             @JsonProperty("boundaryMonth") Integer boundaryMonth,
                             @JsonProperty("boundaryDay") Integer boundaryDay) {
        if (capMinutes != null && capMinutes < 0) {
            throw new ValidationException("Carryover capMinutes must be >= 0, got " + capMinutes);
        }
        if (expiresAfterDays != null && expiresAfterDays <= 0) {
            throw new ValidationException("Carryover expiresAfterDays must be > 0, got " + expiresAfterDays);
        }
        if ((boundaryMonth == null) != (boundaryDay == null)) {
            throw new ValidationException("Carryover boundaryMonth and boundaryDay must be provided together");
        }
        this.enabled = enabled;
        this.capMinutes = capMinutes;
        this.expiresAfterDays = expiresAfterDays;
        this.boundaryMonth = boundaryMonth != null ? boundaryMonth : 1;
        this.boundaryDay = boundaryDay != null ? boundaryDay : 1;
        try {
            MonthDay.of(this.boundaryMonth, this.boundaryDay);
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid carryover boundary: " + e.getMessage());
        }
    }

    public MonthDay boundary() {
        return MonthDay.of(boundaryMonth, boundaryDay);
    }
}
