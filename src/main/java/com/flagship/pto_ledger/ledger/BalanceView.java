package com.flagship.pto_ledger.ledger;

import com.flagship.pto_ledger.policy.DisplayUnit;
import com.flagship.pto_ledger.policy.PolicyKind;
import com.flagship.pto_ledger.policy.PolicyVersion;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A balance as reported to callers. {@code availableMinutes} is null for unlimited policies.
 */
@Value
public class BalanceView {
    UUID companyId;
    UUID employeeId;
    UUID policyId;
    PolicyKind kind;
    DisplayUnit displayUnit;
    long accruedMinutes;
    long usedMinutes;
    long heldMinutes;
    Long availableMinutes;
    long version;
    Instant updatedAt;

    public static BalanceView of(BalanceSnapshot snapshot, PolicyVersion policyVersion) {
        boolean unlimited = policyVersion.getKind() == PolicyKind.UNLIMITED;
        BalanceKey key = snapshot.getKey();
        return new BalanceView(
            key.getCompanyId(),
            key.getEmployeeId(),
            key.getPolicyId(),
            policyVersion.getKind(),
            policyVersion.getDisplayUnit(),
            snapshot.getAccruedMinutes(),
            snapshot.getUsedMinutes(),
            snapshot.getHeldMinutes(),
            unlimited ? null : snapshot.availableMinutes(),
            snapshot.getVersion(),
            snapshot.getUpdatedAt()
        );
    }
}
