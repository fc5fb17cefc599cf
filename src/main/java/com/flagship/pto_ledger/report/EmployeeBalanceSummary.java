package com.flagship.pto_ledger.report;

import com.flagship.pto_ledger.ledger.BalanceView;
import com.flagship.pto_ledger.policy.PolicyCategory;
import lombok.Value;

/**
 * One row of the company balance report: an active assignment and its current balance.
 */
@Value
public class EmployeeBalanceSummary {
    String policyKey;
    PolicyCategory policyCategory;
    BalanceView balance;

    public boolean isUnlimited() {
        return balance.getAvailableMinutes() == null;
    }
}
