package com.flagship.pto_ledger.duration;

import com.flagship.pto_ledger.exception.InvalidRangeException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Set;

/**
 * Converts a wall-clock range into chargeable working minutes.
 *
 * Each local calendar day touched by the range contributes the overlap of the range with that
 * day's working window. Weekends and holidays contribute nothing. Windows are anchored in the
 * employee's zone, so a day that crosses a DST change still yields at most one workday.
 *
 * Stateless; safe to share across threads.
 */
@Component
public class DurationCalculator {

    /**
     * @return chargeable minutes, possibly 0 when the range covers no working time
     * @throws InvalidRangeException when {@code endAt} is not after {@code startAt}
     */
    public int computeMinutes(Instant startAt, Instant endAt, WorkSchedule schedule, Set<LocalDate> holidays) {
        if (startAt == null || endAt == null || !endAt.isAfter(startAt)) {
            throw new InvalidRangeException(String.format("Invalid range: startAt=%s, endAt=%s", startAt, endAt));
        }

        ZoneId zone = schedule.getTimezone();
        // Start a day early: a window that runs past midnight belongs to the previous date.
        LocalDate firstDay = startAt.atZone(zone).toLocalDate().minusDays(1);
        LocalDate lastDay = endAt.atZone(zone).toLocalDate();

        long total = 0;
        for (LocalDate day = firstDay; !day.isAfter(lastDay); day = day.plusDays(1)) {
            if (!schedule.isWorkday(day) || holidays.contains(day)) {
                continue;
            }
            Instant windowStart = ZonedDateTime.of(day, schedule.getWorkStart(), zone).toInstant();
            Instant windowEnd = windowStart.plus(Duration.ofMinutes(schedule.getWorkdayMinutes()));

            Instant from = startAt.isAfter(windowStart) ? startAt : windowStart;
            Instant to = endAt.isBefore(windowEnd) ? endAt : windowEnd;
            if (to.isAfter(from)) {
                total += Duration.between(from, to).toMinutes();
            }
        }
        return Math.toIntExact(total);
    }
}
