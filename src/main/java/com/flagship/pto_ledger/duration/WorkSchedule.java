package com.flagship.pto_ledger.duration;

import com.flagship.pto_ledger.directory.EmployeeSchedule;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

/**
 * A daily working window: {@code workdayMinutes} starting at {@code workStart} local time,
 * on every day that is not a weekend day.
 */
@Value
public class WorkSchedule {
    int workdayMinutes;
    LocalTime workStart;
    ZoneId timezone;
    Set<DayOfWeek> weekendDays;

    public static WorkSchedule of(EmployeeSchedule employee, LocalTime workStart) {
        return new WorkSchedule(employee.getWorkdayMinutes(), workStart, employee.getTimezone(),
                EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));
    }

    public boolean isWorkday(LocalDate date) {
        return !weekendDays.contains(date.getDayOfWeek());
    }
}
