package com.flagship.pto_ledger.directory;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JdbcHolidayCalendar implements HolidayCalendar {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Set<LocalDate> listHolidays(UUID companyId, LocalDate from, LocalDate to) {
        return new HashSet<>(jdbcTemplate.query(
            "SELECT holiday_date FROM company_holidays WHERE company_id = ? AND holiday_date BETWEEN ? AND ?",
            (rs, rowNum) -> rs.getDate("holiday_date").toLocalDate(),
            companyId,
            Date.valueOf(from),
            Date.valueOf(to)
        ));
    }
}
