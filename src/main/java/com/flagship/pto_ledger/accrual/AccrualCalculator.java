package com.flagship.pto_ledger.accrual;

import com.flagship.pto_ledger.assignment.Assignment;
import com.flagship.pto_ledger.policy.AccrualRatio;
import com.flagship.pto_ledger.policy.AccrualTiming;
import com.flagship.pto_ledger.policy.ProrationMethod;
import com.flagship.pto_ledger.policy.TenureTier;
import com.flagship.pto_ledger.policy.TimeAccrualSettings;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Accrual arithmetic. Whole minutes throughout; the only rounding step is proration, which
 * rounds half up.
 *
 * Stateless; safe to share across threads.
 */
@Component
public class AccrualCalculator {

    /**
     * Whether {@code date} is a posting day for {@code assignment} under {@code settings}.
     *
     * DAILY posts every day. MONTHLY and YEARLY post on the first day of the period
     * (START_OF_PERIOD) or the last (END_OF_PERIOD). An assignment that starts mid-period also
     * posts on its start date under START_OF_PERIOD, and one that ends mid-period posts on its
     * last active day under END_OF_PERIOD, so partial periods are not lost.
     */
    public boolean isAccrualDate(LocalDate date, TimeAccrualSettings settings, Assignment assignment) {
        AccrualPeriod period = AccrualPeriod.containing(date, settings.getFrequency());
        if (period.getStart().equals(period.getEnd())) {
            return true;
        }
        if (settings.getTiming() == AccrualTiming.START_OF_PERIOD) {
            return date.equals(period.getStart())
                || (date.equals(assignment.getEffectiveFrom()) && date.isAfter(period.getStart()));
        }
        LocalDate lastActiveDay = assignment.getEffectiveTo() == null ? null : assignment.getEffectiveTo().minusDays(1);
        return date.equals(period.getEnd())
            || (date.equals(lastActiveDay) && date.isBefore(period.getEnd()));
    }

    /**
     * Days of {@code period} on which the assignment is active.
     */
    public long activeDays(AccrualPeriod period, Assignment assignment) {
        LocalDate from = assignment.getEffectiveFrom().isAfter(period.getStart())
            ? assignment.getEffectiveFrom()
            : period.getStart();
        LocalDate lastActive = assignment.getEffectiveTo() == null ? period.getEnd() : assignment.getEffectiveTo().minusDays(1);
        LocalDate to = lastActive.isBefore(period.getEnd()) ? lastActive : period.getEnd();
        return to.isBefore(from) ? 0 : ChronoUnit.DAYS.between(from, to) + 1;
    }

    /**
     * Full calendar months from {@code tenureStart} to {@code date}; 0 before the start.
     */
    public long tenureMonths(LocalDate tenureStart, LocalDate date) {
        if (tenureStart == null || date.isBefore(tenureStart)) {
            return 0;
        }
        return ChronoUnit.MONTHS.between(tenureStart, date);
    }

    /**
     * Rate of the highest tier the employee qualifies for, else the base rate.
     */
    public int ratePerPeriod(TimeAccrualSettings settings, long tenureMonths) {
        int rate = settings.getRateMinutes();
        for (TenureTier tier : settings.getTenureTiers()) {
            if (tier.getMinMonths() <= tenureMonths) {
                rate = tier.getRateMinutes();
            }
        }
        return rate;
    }

    /**
     * {@code rate × activeDays / periodDays}, rounded half up.
     */
    public int prorate(int rate, long activeDays, long periodDays, ProrationMethod method) {
        if (activeDays <= 0) {
            return 0;
        }
        if (method == ProrationMethod.NONE || activeDays >= periodDays) {
            return rate;
        }
        return BigDecimal.valueOf(rate)
            .multiply(BigDecimal.valueOf(activeDays))
            .divide(BigDecimal.valueOf(periodDays), 0, RoundingMode.HALF_UP)
            .intValueExact();
    }

    /**
     * Part of {@code increment} that fits under the bank cap. Never negative.
     */
    public int clampToCap(int increment, long accruedMinutes, Long bankCapMinutes) {
        if (bankCapMinutes == null) {
            return Math.max(increment, 0);
        }
        long headroom = bankCapMinutes - accruedMinutes;
        if (headroom <= 0) {
            return 0;
        }
        return (int) Math.min(increment, headroom);
    }

    /**
     * {@code floor(workedMinutes × accrueMinutes / perWorkedMinutes)}, saturating at
     * {@link Integer#MAX_VALUE}. The bank cap clamp applies afterwards.
     */
    public int hoursWorkedAccrual(int workedMinutes, AccrualRatio ratio) {
        if (workedMinutes <= 0) {
            return 0;
        }
        long earned = (long) workedMinutes * ratio.getAccrueMinutes() / ratio.getPerWorkedMinutes();
        return (int) Math.min(earned, Integer.MAX_VALUE);
    }
}
