package com.flagship.pto_ledger.accrual;

import com.flagship.pto_ledger.assignment.Assignment;
import com.flagship.pto_ledger.policy.AccrualFrequency;
import com.flagship.pto_ledger.policy.AccrualRatio;
import com.flagship.pto_ledger.policy.AccrualTiming;
import com.flagship.pto_ledger.policy.ProrationMethod;
import com.flagship.pto_ledger.policy.TenureTier;
import com.flagship.pto_ledger.policy.TimeAccrualSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AccrualCalculatorTest {

    private final AccrualCalculator calculator = new AccrualCalculator();

    private static Assignment assignment(LocalDate from, LocalDate to) {
        return new Assignment(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                from, to, null, null);
    }

    private static TimeAccrualSettings monthly(AccrualTiming timing) {
        return TimeAccrualSettings.builder()
            .frequency(AccrualFrequency.MONTHLY)
            .timing(timing)
            .rateMinutes(800)
            .build();
    }

    @Test
    @DisplayName("Half a month active earns half the monthly rate")
    void proratesPartialMonth() {
        Assignment midMonth = assignment(LocalDate.of(2024, 6, 16), null);
        AccrualPeriod june = AccrualPeriod.containing(LocalDate.of(2024, 6, 16), AccrualFrequency.MONTHLY);

        long activeDays = calculator.activeDays(june, midMonth);
        int earned = calculator.prorate(800, activeDays, june.lengthInDays(), ProrationMethod.DAYS_ACTIVE);

        assertEquals(15, activeDays);
        assertEquals(30, june.lengthInDays());
        assertEquals(400, earned);
    }

    @Test
    @DisplayName("Proration rounds half up and NONE pays the full rate")
    void prorationRounding() {
        assertEquals(27, calculator.prorate(800, 1, 30, ProrationMethod.DAYS_ACTIVE));
        assertEquals(800, calculator.prorate(800, 1, 30, ProrationMethod.NONE));
        assertEquals(0, calculator.prorate(800, 0, 30, ProrationMethod.NONE));
    }

    @Test
    @DisplayName("Bank cap clamps the increment to the remaining headroom")
    void clampsToCap() {
        assertEquals(100, calculator.clampToCap(800, 14_900, 15_000L));
        assertEquals(0, calculator.clampToCap(800, 15_000, 15_000L));
        assertEquals(0, calculator.clampToCap(800, 15_200, 15_000L));
        assertEquals(800, calculator.clampToCap(800, 14_900, null));
    }

    @Test
    @DisplayName("Highest qualifying tenure tier wins")
    void tenureTiers() {
        TimeAccrualSettings tiered = TimeAccrualSettings.builder()
            .frequency(AccrualFrequency.MONTHLY)
            .rateMinutes(800)
            .tenureTiers(List.of(new TenureTier(60, 1200), new TenureTier(12, 1000)))
            .build();

        assertEquals(800, calculator.ratePerPeriod(tiered, 11));
        assertEquals(1000, calculator.ratePerPeriod(tiered, 12));
        assertEquals(1000, calculator.ratePerPeriod(tiered, 59));
        assertEquals(1200, calculator.ratePerPeriod(tiered, 61));
    }

    @Test
    @DisplayName("Tenure counts full calendar months only")
    void tenureMonths() {
        LocalDate hired = LocalDate.of(2023, 1, 31);

        assertEquals(0, calculator.tenureMonths(hired, LocalDate.of(2023, 2, 27)));
        assertEquals(12, calculator.tenureMonths(hired, LocalDate.of(2024, 1, 31)));
        assertEquals(0, calculator.tenureMonths(hired, LocalDate.of(2022, 12, 1)));
    }

    @Test
    @DisplayName("Hours-worked accrual floors the result")
    void hoursWorkedFloors() {
        AccrualRatio oneHourPerThirty = new AccrualRatio(60, 1800);

        assertEquals(80, calculator.hoursWorkedAccrual(2400, oneHourPerThirty));
        assertEquals(1, calculator.hoursWorkedAccrual(59, new AccrualRatio(1, 30)));
        assertEquals(0, calculator.hoursWorkedAccrual(29, new AccrualRatio(1, 30)));
    }

    @Test
    @DisplayName("Hours-worked accrual saturates instead of overflowing on generous ratios")
    void hoursWorkedSaturates() {
        AccrualRatio generous = new AccrualRatio(600, 1);

        assertEquals(Integer.MAX_VALUE, calculator.hoursWorkedAccrual(10_000_000, generous));
        assertEquals(0, calculator.clampToCap(
                calculator.hoursWorkedAccrual(10_000_000, generous), 9_600, 9_600L));
        assertEquals(6_000, calculator.hoursWorkedAccrual(10, generous));
    }

    @Test
    @DisplayName("Start-of-period posts on the first day and on a mid-period start")
    void startOfPeriodDates() {
        TimeAccrualSettings settings = monthly(AccrualTiming.START_OF_PERIOD);
        Assignment midMonth = assignment(LocalDate.of(2024, 6, 16), null);

        assertTrue(calculator.isAccrualDate(LocalDate.of(2024, 6, 16), settings, midMonth));
        assertTrue(calculator.isAccrualDate(LocalDate.of(2024, 7, 1), settings, midMonth));
        assertFalse(calculator.isAccrualDate(LocalDate.of(2024, 7, 2), settings, midMonth));
    }

    @Test
    @DisplayName("End-of-period posts on the last day and on the last active day")
    void endOfPeriodDates() {
        TimeAccrualSettings settings = monthly(AccrualTiming.END_OF_PERIOD);
        Assignment endsMidMonth = assignment(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 11));

        assertTrue(calculator.isAccrualDate(LocalDate.of(2024, 5, 31), settings, endsMidMonth));
        assertTrue(calculator.isAccrualDate(LocalDate.of(2024, 6, 10), settings, endsMidMonth));
        assertFalse(calculator.isAccrualDate(LocalDate.of(2024, 6, 1), settings, endsMidMonth));
    }
}
