package com.flagship.pto_ledger.directory;

import java.util.UUID;

/**
 * Read-only view of employee records owned by another service.
 */
public interface EmployeeDirectory {

    /**
     * Returns the employee's schedule. Unknown employees get the configured defaults
     * and a null hire date.
     */
    EmployeeSchedule getSchedule(UUID companyId, UUID employeeId);
}
