package com.flagship.pto_ledger.policy;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.flagship.pto_ledger.ledger.BalanceRules;
import lombok.Value;

@Value
@JsonTypeName("UNLIMITED")
public class UnlimitedSettings implements PolicySettings {

    @Override
    public PolicyKind kind() {
        return PolicyKind.UNLIMITED;
    }

    @Override
    public BalanceRules balanceRules() {
        return BalanceRules.unlimitedBalance();
    }

    @Override
    public CarryoverSettings carryoverRules() {
        return null;
    }

    @Override
    public ExpirationSettings expirationRules() {
        return null;
    }
}
