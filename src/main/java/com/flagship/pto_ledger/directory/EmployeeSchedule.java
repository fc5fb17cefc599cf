package com.flagship.pto_ledger.directory;

import lombok.Value;

import java.time.LocalDate;
import java.time.ZoneId;

/**
 * What the ledger needs to know about an employee's working time.
 */
@Value
public class EmployeeSchedule {
    int workdayMinutes;
    ZoneId timezone;
    LocalDate hireDate;
}
