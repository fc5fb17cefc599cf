package com.flagship.pto_ledger.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.ledger.BalanceRules;
import lombok.Builder;
import lombok.Value;

/**
 * Accrual driven by payroll-reported worked minutes.
 */
@Value
@JsonTypeName("HOURS_WORKED_ACCRUAL")
public class HoursWorkedAccrualSettings implements PolicySettings {
    AccrualRatio ratio;
    boolean allowNegative;
    Integer negativeLimitMinutes;
    Integer bankCapMinutes;
    CarryoverSettings carryover;
    ExpirationSettings expiration;

    @Builder
    @JsonCreator
    public HoursWorkedAccrualSettings(@JsonProperty("ratio") AccrualRatio ratio,
                                      @JsonProperty("allowNegative") boolean allowNegative,
                                      @JsonProperty("negativeLimitMinutes") Integer negativeLimitMinutes,
                                      @JsonProperty("bankCapMinutes") Integer bankCapMinutes,
                                      @JsonProperty("carryover") CarryoverSettings carryover,
                                      @JsonProperty("expiration") ExpirationSettings expiration) {
        if (ratio == null) {
            throw new ValidationException("Hours-worked accrual requires a ratio");
        }
        SettingsChecks.checkNegativeAndCap(allowNegative, negativeLimitMinutes, bankCapMinutes);
        this.ratio = ratio;
        this.allowNegative = allowNegative;
        this.negativeLimitMinutes = negativeLimitMinutes;
        this.bankCapMinutes = bankCapMinutes;
        this.carryover = carryover;
        this.expiration = expiration;
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.HOURS_WORKED_ACCRUAL;
    }

    @Override
    public BalanceRules balanceRules() {
        return BalanceRules.limited(allowNegative, negativeLimitMinutes, bankCapMinutes);
    }

    @Override
    public CarryoverSettings carryoverRules() {
        return carryover;
    }

    @Override
    public ExpirationSettings expirationRules() {
        return expiration;
    }
}
