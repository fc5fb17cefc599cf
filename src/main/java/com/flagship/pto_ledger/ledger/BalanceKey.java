package com.flagship.pto_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Identity of one balance: the unit of locking and of snapshot storage.
 */
@Value
public class BalanceKey {
    UUID companyId;
    UUID employeeId;
    UUID policyId;

    public static BalanceKey of(UUID companyId, UUID employeeId, UUID policyId) {
        return new BalanceKey(companyId, employeeId, policyId);
    }

    @Override
    public String toString() {
        return companyId + "/" + employeeId + "/" + policyId;
    }
}
