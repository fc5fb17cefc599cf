package com.flagship.pto_ledger.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.ledger.BalanceRules;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed-rate accrual per calendar period.
 *
 * {@code rateMinutes} is the amount earned per full period of {@code frequency}. Tenure tiers,
 * when present, replace the base rate once the employee qualifies; they are kept sorted by
 * {@code minMonths}.
 */
@Value
@JsonTypeName("TIME_ACCRUAL")
public class TimeAccrualSettings implements PolicySettings {
    AccrualFrequency frequency;
    AccrualTiming timing;
    int rateMinutes;
    ProrationMethod proration;
    boolean allowNegative;
    Integer negativeLimitMinutes;
    Integer bankCapMinutes;
    List<TenureTier> tenureTiers;
    CarryoverSettings carryover;
    ExpirationSettings expiration;

    @Builder
    @JsonCreator
    public TimeAccrualSettings(@JsonProperty("frequency") AccrualFrequency frequency,
                               @JsonProperty("timing") AccrualTiming timing,
                               @JsonProperty("rateMinutes") int rateMinutes,
                               @JsonProperty("proration") ProrationMethod proration,
                               @JsonProperty("allowNegative") boolean allowNegative,
                               @JsonProperty("negativeLimitMinutes") Integer negativeLimitMinutes,
                               @JsonProperty("bankCapMinutes") Integer bankCapMinutes,
                               @JsonProperty("tenureTiers") List<TenureTier> tenureTiers,
                               @JsonProperty("carryover") CarryoverSettings carryover,
                               @JsonProperty("expiration") ExpirationSettings expiration) {
        if (frequency == null) {
            throw new ValidationException("Time accrual requires a frequency");
        }
        if (rateMinutes <= 0) {
            throw new ValidationException("Time accrual rateMinutes must be > 0, got " + rateMinutes);
        }
        SettingsChecks.checkNegativeAndCap(allowNegative, negativeLimitMinutes, bankCapMinutes);
        List<TenureTier> tiers = tenureTiers == null ? List.of() : tenureTiers;
        Set<Integer> seen = new HashSet<>();
        for (TenureTier tier : tiers) {
            if (!seen.add(tier.getMinMonths())) {
                throw new ValidationException("Duplicate tenure tier for minMonths=" + tier.getMinMonths());
            }
        }
        this.frequency = frequency;
        this.timing = timing != null ? timing : AccrualTiming.START_OF_PERIOD;
        this.rateMinutes = rateMinutes;
        this.proration = proration != null ? proration : ProrationMethod.DAYS_ACTIVE;
        this.allowNegative = allowNegative;
        this.negativeLimitMinutes = negativeLimitMinutes;
        this.bankCapMinutes = bankCapMinutes;
        this.tenureTiers = tiers.stream()
                .sorted(Comparator.comparingInt(TenureTier::getMinMonths))
                .toList();
        this.carryover = carryover;
        this.expiration = expiration;
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.TIME_ACCRUAL;
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
