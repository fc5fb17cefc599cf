package com.flagship.pto_ledger.directory;

import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

/**
 * Company holidays, read-only.
 */
public interface HolidayCalendar {

    /**
     * Holidays between {@code from} and {@code to}, both inclusive.
     */
    Set<LocalDate> listHolidays(UUID companyId, LocalDate from, LocalDate to);
}
