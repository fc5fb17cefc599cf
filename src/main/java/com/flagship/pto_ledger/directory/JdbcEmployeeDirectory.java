package com.flagship.pto_ledger.directory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

/**
 * {@link EmployeeDirectory} over the replicated {@code employees} table.
 */
@Component
@Slf4j
public class JdbcEmployeeDirectory implements EmployeeDirectory {

    private final JdbcTemplate jdbcTemplate;
    private final int defaultWorkdayMinutes;
    private final ZoneId defaultTimezone;

    public JdbcEmployeeDirectory(JdbcTemplate jdbcTemplate,
                                 @Value("${pto.schedule.default-workday-minutes:480}") int defaultWorkdayMinutes,
                                 @Value("${pto.schedule.default-timezone:UTC}") String defaultTimezone) {
        this.jdbcTemplate = jdbcTemplate;
        this.defaultWorkdayMinutes = defaultWorkdayMinutes;
        this.defaultTimezone = ZoneId.of(defaultTimezone);
    }

    @Override
    public EmployeeSchedule getSchedule(UUID companyId, UUID employeeId) {
        List<EmployeeSchedule> rows = jdbcTemplate.query(
            "SELECT workday_minutes, timezone, hire_date FROM employees WHERE id = ? AND company_id = ?",
            (rs, rowNum) -> {
                Date hireDate = rs.getDate("hire_date");
                return new EmployeeSchedule(
                    rs.getInt("workday_minutes"),
                    parseZone(rs.getString("timezone"), employeeId),
                    hireDate != null ? hireDate.toLocalDate() : null
                );
            },
            employeeId,
            companyId
        );

        if (rows.isEmpty()) {
            log.debug("Employee not in directory, using default schedule: employeeId={}", employeeId);
            return new EmployeeSchedule(defaultWorkdayMinutes, defaultTimezone, null);
        }
        return rows.get(0);
    }

    private ZoneId parseZone(String zone, UUID employeeId) {
        if (zone == null || zone.isBlank()) {
            return defaultTimezone;
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("Unknown timezone '{}' for employee {}, using {}", zone, employeeId, defaultTimezone);
            return defaultTimezone;
        }
    }
}
