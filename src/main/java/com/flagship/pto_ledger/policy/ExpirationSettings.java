package com.flagship.pto_ledger.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.DateTimeException;
import java.time.MonthDay;

/**
 * Expiration rules: accruals older than {@code expiresAfterDays}, and/or the whole balance on a
 * fixed calendar date ({@code expiresOnMonth}/{@code expiresOnDay}).
 */
@Value
public class ExpirationSettings {
    boolean enabled;
    Integer expiresAfterDays;
    Integer expiresOnMonth;
    Integer expiresOnDay;

    @Builder
    @JsonCreator
    public ExpirationSettings(@JsonProperty("enabled") boolean enabled,
                              @JsonProperty("expiresAfterDays") Integer expiresAfterDays,
                              @JsonProperty("expiresOnMonth") Integer expiresOnMonth,
                              @JsonProperty("expiresOnDay") Integer expiresOnDay) {
        if (expiresAfterDays != null && expiresAfterDays <= 0) {
            throw new ValidationException("Expiration expiresAfterDays must be > 0, got " + expiresAfterDays);
        }
        if ((expiresOnMonth == null) != (expiresOnDay == null)) {
            throw new ValidationException("expiresOnMonth and expiresOnDay must be provided together");
        }
        if (expiresOnMonth != null) {
            try {
                MonthDay.of(expiresOnMonth, expiresOnDay);
            } catch (DateTimeException e) {
                throw new ValidationException("Invalid expiration date: " + e.getMessage());
            }
        }
        if (enabled && expiresAfterDays == null && expiresOnMonth == null) {
            throw new ValidationException(
                    "Enabled expiration requires expiresAfterDays or expiresOnMonth/expiresOnDay");
        }
        this.enabled = enabled;
        this.expiresAfterDays = expiresAfterDays;
        this.expiresOnMonth = expiresOnMonth;
        this.expiresOnDay = expiresOnDay;
    }

    /**
     * Calendar expiration date, or {@code null} when only age-based expiration is configured.
     */
    public MonthDay calendarDate() {
        return expiresOnMonth == null ? null : MonthDay.of(expiresOnMonth, expiresOnDay);
    }
}
