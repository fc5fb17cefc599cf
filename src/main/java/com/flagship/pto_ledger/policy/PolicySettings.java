package com.flagship.pto_ledger.policy;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.pto_ledger.ledger.BalanceRules;

/**
 * Kind-specific rules of a policy version, a closed set of three variants.
 *
 * Stored as JSON with a {@code type} discriminator. Each variant validates itself on
 * construction, so a settings object that exists is a valid one.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = UnlimitedSettings.class, name = "UNLIMITED"),
        @JsonSubTypes.Type(value = TimeAccrualSettings.class, name = "TIME_ACCRUAL"),
        @JsonSubTypes.Type(value = HoursWorkedAccrualSettings.class, name = "HOURS_WORKED_ACCRUAL")
})
public interface PolicySettings {

    PolicyKind kind();

    BalanceRules balanceRules();

    /**
     * Year-end carryover rules, or {@code null} when the kind has none.
     */
    CarryoverSettings carryoverRules();

    /**
     * Expiration rules, or {@code null} when the kind has none.
     */
    ExpirationSettings expirationRules();
}
