package com.flagship.pto_ledger.ledger;

import lombok.Value;

/**
 * The spending limits a policy version places on a balance.
 *
 * For limited policies the available balance must stay at or above {@link #floorMinutes()}:
 * zero by default, {@code -negativeLimitMinutes} when negatives are allowed, and unbounded
 * when negatives are allowed without a limit. Unlimited policies have no available balance.
 */
@Value
public class BalanceRules {
    boolean unlimited;
    boolean allowNegative;
    Long negativeLimitMinutes;
    Long bankCapMinutes;

    public static BalanceRules unlimitedBalance() {
        return new BalanceRules(true, true, null, null);
    }

    public static BalanceRules limited(boolean allowNegative, Integer negativeLimitMinutes, Integer bankCapMinutes) {
        return new BalanceRules(
                false,
                allowNegative,
                allowNegative && negativeLimitMinutes != null ? Long.valueOf(negativeLimitMinutes) : null,
                bankCapMinutes != null ? Long.valueOf(bankCapMinutes) : null
        );
    }

    /**
     * Lowest available balance a write may leave behind, or {@code null} when nothing is enforced.
     */
    public Long floorMinutes() {
        if (unlimited) {
            return null;
        }
        if (!allowNegative) {
            return 0L;
        }
        return negativeLimitMinutes == null ? null : -negativeLimitMinutes;
    }

    public boolean permits(long availableMinutes) {
        Long floor = floorMinutes();
        return floor == null || availableMinutes >= floor;
    }
}
