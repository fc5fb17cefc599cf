package com.flagship.pto_ledger.observability;

import com.flagship.pto_ledger.request.RequestStatus;
import com.flagship.pto_ledger.request.TimeOffRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the database-backed gauges off the scrape path.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final PtoMetrics ptoMetrics;
    private final TimeOffRequestRepository requestRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        try {
            ptoMetrics.updatePendingRequests(requestRepository.countByStatus(RequestStatus.SUBMITTED));
        } catch (DataAccessException e) {
            log.warn("Failed to refresh pending request gauge: {}", e.getMessage());
        }
    }
}
