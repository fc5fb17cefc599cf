package com.flagship.pto_ledger.accrual;

import com.flagship.pto_ledger.policy.AccrualFrequency;
import lombok.Value;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * One accrual period, {@code [start, end]} with both days inclusive.
 */
@Value
public class AccrualPeriod {

    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");

    AccrualFrequency frequency;
    LocalDate start;
    LocalDate end;

    public static AccrualPeriod containing(LocalDate date, AccrualFrequency frequency) {
        return switch (frequency) {
            case DAILY -> new AccrualPeriod(frequency, date, date);
            case MONTHLY -> new AccrualPeriod(frequency,
                    date.with(TemporalAdjusters.firstDayOfMonth()),
                    date.with(TemporalAdjusters.lastDayOfMonth()));
            case YEARLY -> new AccrualPeriod(frequency,
                    date.with(TemporalAdjusters.firstDayOfYear()),
                    date.with(TemporalAdjusters.lastDayOfYear()));
        };
    }

    public long lengthInDays() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    /**
     * Stable key used in accrual source ids: {@code yyyy-MM-dd}, {@code yyyy-MM} or {@code yyyy}.
     */
    public String key() {
        return switch (frequency) {
            case DAILY -> start.toString();
            case MONTHLY -> start.format(MONTH_KEY);
            case YEARLY -> String.valueOf(start.getYear());
        };
    }
}
