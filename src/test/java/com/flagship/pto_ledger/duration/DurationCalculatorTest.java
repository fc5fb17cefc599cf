package com.flagship.pto_ledger.duration;

import com.flagship.pto_ledger.exception.InvalidRangeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DurationCalculatorTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private final DurationCalculator calculator = new DurationCalculator();

    private final WorkSchedule eightHourDay = new WorkSchedule(480, LocalTime.of(9, 0), NEW_YORK,
            EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));

    private static Instant at(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, NEW_YORK).toInstant();
    }

    @Test
    @DisplayName("A full workday costs the configured workday minutes")
    void fullWorkday() {
        // Monday 2024-03-04
        int minutes = calculator.computeMinutes(at(2024, 3, 4, 0, 0), at(2024, 3, 5, 0, 0), eightHourDay, Set.of());

        assertEquals(480, minutes);
    }

    @Test
    @DisplayName("Partial day charges only the overlap with the working window")
    void partialDay() {
        int minutes = calculator.computeMinutes(at(2024, 3, 4, 13, 0), at(2024, 3, 4, 20, 0), eightHourDay, Set.of());

        // Window is 09:00-17:00, so 13:00-17:00
        assertEquals(240, minutes);
    }

    @Test
    @DisplayName("Weekends and holidays are free")
    void skipsWeekendsAndHolidays() {
        // Friday 2024-03-08 through Tuesday 2024-03-12, Monday is a holiday
        Set<LocalDate> holidays = Set.of(LocalDate.of(2024, 3, 11));
        int minutes = calculator.computeMinutes(at(2024, 3, 8, 0, 0), at(2024, 3, 13, 0, 0), eightHourDay, holidays);

        assertEquals(2 * 480, minutes);
    }

    @Test
    @DisplayName("A day crossing the spring DST change still charges one workday")
    void dstSpringForward() {
        // 2024-03-10 is Sunday; the following Monday is a normal day after the change
        int minutes = calculator.computeMinutes(at(2024, 3, 9, 0, 0), at(2024, 3, 12, 0, 0), eightHourDay, Set.of());

        assertEquals(480, minutes);
    }

    @Test
    @DisplayName("A range covering only a weekend is zero minutes")
    void weekendOnlyIsZero() {
        int minutes = calculator.computeMinutes(at(2024, 3, 9, 0, 0), at(2024, 3, 11, 0, 0), eightHourDay, Set.of());

        assertEquals(0, minutes);
    }

    @Test
    @DisplayName("End before start is an invalid range")
    void rejectsInvertedRange() {
        assertThrows(InvalidRangeException.class,
            () -> calculator.computeMinutes(at(2024, 3, 5, 0, 0), at(2024, 3, 4, 0, 0), eightHourDay, Set.of()));
        assertThrows(InvalidRangeException.class,
            () -> calculator.computeMinutes(at(2024, 3, 5, 0, 0), at(2024, 3, 5, 0, 0), eightHourDay, Set.of()));
    }
}
