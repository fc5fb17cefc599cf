package com.flagship.pto_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pto_ledger.AbstractIntegrationTest;
import com.flagship.pto_ledger.exception.InsufficientBalanceException;
import com.flagship.pto_ledger.ledger.AdjustmentService;
import com.flagship.pto_ledger.policy.TimeOffPolicy;
import com.flagship.pto_ledger.request.NewTimeOffRequest;
import com.flagship.pto_ledger.request.TimeOffRequest;
import com.flagship.pto_ledger.request.TimeOffRequestService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox rows are written with the business change they describe, or not at all.
 */
class OutboxServiceTest extends AbstractIntegrationTest {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private TimeOffRequestService requestService;

    @Autowired
    private AdjustmentService adjustmentService;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID employeeId;
    private UUID policyId;

    @BeforeEach
    void setUp() {
        employeeId = createEmployee(480, "UTC", null);
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 1, 1), monthlyAccrual(480, null, null, null));
        policyId = policy.getId();
        assign(employeeId, policyId, LocalDate.of(2024, 1, 1));
    }

    private NewTimeOffRequest oneDay() {
        return NewTimeOffRequest.builder()
            .companyId(companyId)
            .employeeId(employeeId)
            .policyId(policyId)
            .startAt(Instant.parse("2024-03-04T00:00:00Z"))
            .endAt(Instant.parse("2024-03-05T00:00:00Z"))
            .build();
    }

    @Test
    @DisplayName("Each request transition stages one event, in order")
    void requestTransitionsStageEvents() throws Exception {
        printTestHeader("Request events in the outbox");
        adjustmentService.createAdjustment(companyId, employeeId, policyId, 480, LocalDate.of(2024, 1, 1),
                "Opening balance", null, null);

        TimeOffRequest request = requestService.submitRequest(oneDay());
        requestService.cancelRequest(companyId, request.getId(), employeeId);

        List<OutboxEvent> events = outboxService.getEventsForAggregate("TimeOffRequest", request.getId());
        events.forEach(e -> printOutput(e.getEventType(), e.getPayload()));

        assertEquals(List.of("TimeOffRequestSubmitted", "TimeOffRequestCancelled"),
                events.stream().map(OutboxEvent::getEventType).toList());
        assertTrue(events.get(0).getSequenceNumber() < events.get(1).getSequenceNumber());
        assertFalse(events.get(0).isPublished());

        JsonNode cancelled = objectMapper.readTree(events.get(1).getPayload());
        assertEquals("SUBMITTED", cancelled.get("previousStatus").asText());
        assertEquals(480, cancelled.get("requestedMinutes").asInt());
        printSuccess("Submitted and cancelled events staged");
    }

    @Test
    @DisplayName("A refused submission stages no event")
    void refusedSubmissionStagesNothing() {
        assertThrows(InsufficientBalanceException.class, () -> requestService.submitRequest(oneDay()));

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM outbox_events", Integer.class);
        assertEquals(0, count);
    }

    @Test
    @DisplayName("Adjustments stage a balance event")
    void adjustmentStagesEvent() {
        adjustmentService.createAdjustment(companyId, employeeId, policyId, 120, LocalDate.of(2024, 1, 1),
                "Bonus day", null, null);

        List<String> types = jdbcTemplate.queryForList(
            "SELECT event_type FROM outbox_events WHERE aggregate_type = 'LedgerEntry'", String.class);
        assertEquals(List.of("BalanceAdjusted"), types);
    }

    @Test
    @DisplayName("Failed publishes are counted and excluded once retries run out")
    void failedEventsAgeOut() {
        adjustmentService.createAdjustment(companyId, employeeId, policyId, 120, LocalDate.of(2024, 1, 1),
                "Bonus day", null, null);
        OutboxEvent event = outboxService.findPublishable(10, 2).get(0);

        outboxService.markFailed(event.getId(), "broker down");
        assertEquals(1, outboxService.findPublishable(10, 2).size());
        outboxService.markFailed(event.getId(), "broker down");
        assertTrue(outboxService.findPublishable(10, 2).isEmpty());

        outboxService.markPublished(event.getId());
        Integer unpublished = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM outbox_events WHERE published_at IS NULL", Integer.class);
        assertEquals(0, unpublished);
    }
}
