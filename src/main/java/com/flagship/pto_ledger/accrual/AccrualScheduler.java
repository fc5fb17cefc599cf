package com.flagship.pto_ledger.accrual;

import com.flagship.pto_ledger.carryover.CarryoverService;
import com.flagship.pto_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Daily driver for the date-driven jobs: accruals first, then carryover, then expiration,
 * so expirations see the day's accruals and carryover. Every job is idempotent per date,
 * and a failure in one does not stop the others.
 */
@Component
@ConditionalOnProperty(name = "pto.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AccrualScheduler {

    private final AccrualService accrualService;
    private final CarryoverService carryoverService;
    private final Clock clock;

    @Value("${pto.scheduler.zone:UTC}")
    private String zone;

    @Scheduled(cron = "${pto.scheduler.cron:0 15 0 * * *}", zone = "${pto.scheduler.zone:UTC}")
    public void runDailyJobs() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneId.of(zone)));
        CorrelationContext.setCorrelationId("daily-" + today);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        try {
            log.info("Starting daily jobs for {}", today);

            try {
                accrualService.runAccruals(today, null);
            } catch (RuntimeException e) {
                log.error("Accrual run failed for {}", today, e);
            }

            try {
                carryoverService.runCarryover(today, null);
            } catch (RuntimeException e) {
                log.error("Carryover run failed for {}", today, e);
            }

            try {
                carryoverService.runExpiration(today, null);
            } catch (RuntimeException e) {
                log.error("Expiration run failed for {}", today, e);
            }
        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }
}
