package com.flagship.pto_ledger.request;

import com.flagship.pto_ledger.AbstractIntegrationTest;
import com.flagship.pto_ledger.exception.InsufficientBalanceException;
import com.flagship.pto_ledger.exception.InvalidTransitionException;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.ledger.AdjustmentService;
import com.flagship.pto_ledger.ledger.BalanceService;
import com.flagship.pto_ledger.ledger.BalanceView;
import com.flagship.pto_ledger.ledger.LedgerEntry;
import com.flagship.pto_ledger.ledger.LedgerEntryType;
import com.flagship.pto_ledger.policy.TimeOffPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request workflow against a real database: holds, settlements, refusals and idempotency.
 */
class TimeOffRequestServiceTest extends AbstractIntegrationTest {

    @Autowired
    private TimeOffRequestService requestService;

    @Autowired
    private AdjustmentService adjustmentService;

    @Autowired
    private BalanceService balanceService;

    private UUID employeeId;
    private UUID policyId;
    private final UUID managerId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        employeeId = createEmployee(480, "UTC", LocalDate.of(2020, 1, 1));
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 1, 1), monthlyAccrual(800, null, null, null));
        policyId = policy.getId();
        assign(employeeId, policyId, LocalDate.of(2024, 1, 1));
        adjustmentService.createAdjustment(companyId, employeeId, policyId, 960, LocalDate.of(2024, 1, 1),
                "Opening balance", "opening", managerId);
    }

    private NewTimeOffRequest.NewTimeOffRequestBuilder request(String start, String end) {
        return NewTimeOffRequest.builder()
            .companyId(companyId)
            .employeeId(employeeId)
            .policyId(policyId)
            .startAt(Instant.parse(start))
            .endAt(Instant.parse(end))
            .actorId(employeeId);
    }

    private BalanceView balance() {
        return balanceService.getBalance(companyId, employeeId, policyId);
    }

    private List<LedgerEntry> requestEntries(UUID requestId) {
        return balanceService.listLedger(companyId, employeeId, policyId, null, null).stream()
            .filter(e -> e.getSourceId().equals(requestId.toString()))
            .toList();
    }

    private int outboxEvents(UUID requestId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM outbox_events WHERE aggregate_id = ?", Integer.class, requestId);
        return count != null ? count : 0;
    }

    @Test
    @DisplayName("Submitting holds the chargeable minutes")
    void submitHoldsMinutes() {
        printTestHeader("Submit holds minutes");
        TimeOffRequest submitted = requestService.submitRequest(
            request("2024-03-04T00:00:00Z", "2024-03-05T00:00:00Z").build());
        printOutput("Request", submitted);
        printOutput("Balance", balance());

        assertEquals(RequestStatus.SUBMITTED, submitted.getStatus());
        assertEquals(480, submitted.getRequestedMinutes());
        assertEquals(480, balance().getHeldMinutes());
        assertEquals(480L, balance().getAvailableMinutes());
        assertEquals(1, requestEntries(submitted.getId()).size());
        assertEquals(1, outboxEvents(submitted.getId()));
        printSuccess("HOLD posted and event staged");
    }

    @Test
    @DisplayName("Approval turns the hold into usage")
    void approveConvertsHold() {
        TimeOffRequest submitted = requestService.submitRequest(
            request("2024-03-04T00:00:00Z", "2024-03-05T00:00:00Z").build());

        TimeOffRequest approved = requestService.approveRequest(companyId, submitted.getId(), managerId, "Enjoy");

        assertEquals(RequestStatus.APPROVED, approved.getStatus());
        assertEquals(managerId, approved.getDecidedBy());
        assertEquals(0, balance().getHeldMinutes());
        assertEquals(480, balance().getUsedMinutes());
        assertEquals(480L, balance().getAvailableMinutes());
        List<LedgerEntryType> types = requestEntries(submitted.getId()).stream().map(LedgerEntry::getEntryType).toList();
        assertEquals(List.of(LedgerEntryType.HOLD, LedgerEntryType.HOLD_RELEASE, LedgerEntryType.USAGE), types);
        assertEquals(2, outboxEvents(submitted.getId()));
    }

    @Test
    @DisplayName("Denial and cancellation release the hold")
    void denyAndCancelRelease() {
        TimeOffRequest first = requestService.submitRequest(
            request("2024-03-04T00:00:00Z", "2024-03-05T00:00:00Z").build());
        TimeOffRequest second = requestService.submitRequest(
            request("2024-03-05T00:00:00Z", "2024-03-06T00:00:00Z").build());
        assertEquals(0L, balance().getAvailableMinutes());

        requestService.denyRequest(companyId, first.getId(), managerId, "Busy week");
        TimeOffRequest cancelled = requestService.cancelRequest(companyId, second.getId(), employeeId);

        assertEquals(RequestStatus.CANCELLED, cancelled.getStatus());
        assertEquals(0, balance().getHeldMinutes());
        assertEquals(0, balance().getUsedMinutes());
        assertEquals(960L, balance().getAvailableMinutes());
    }

    @Test
    @DisplayName("Drafts hold nothing until submitted")
    void draftLifecycle() {
        TimeOffRequest draft = requestService.createDraft(
            request("2024-03-04T00:00:00Z", "2024-03-05T00:00:00Z").build());
        assertEquals(RequestStatus.DRAFT, draft.getStatus());
        assertEquals(0, balance().getHeldMinutes());

        TimeOffRequest submitted = requestService.submitDraft(companyId, draft.getId(), employeeId);
        assertEquals(RequestStatus.SUBMITTED, submitted.getStatus());
        assertEquals(480, balance().getHeldMinutes());

        TimeOffRequest otherDraft = requestService.createDraft(
            request("2024-03-06T00:00:00Z", "2024-03-07T00:00:00Z").build());
        requestService.cancelRequest(companyId, otherDraft.getId(), employeeId);
        assertTrue(requestEntries(otherDraft.getId()).isEmpty());
    }

    @Test
    @DisplayName("A request larger than the balance is refused and leaves no trace")
    void insufficientBalanceRefused() {
        printTestHeader("Insufficient balance");
        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
            () -> requestService.submitRequest(request("2024-03-04T00:00:00Z", "2024-03-07T00:00:00Z").build()));
        printOutput("Exception", e.getMessage());

        assertEquals(960, e.getAvailableMinutes());
        assertEquals(1440, e.getRequiredMinutes());
        assertTrue(requestService.listRequests(companyId, employeeId, null).isEmpty());
        assertEquals(960L, balance().getAvailableMinutes());
        printSuccess("Refused before anything was written");
    }

    @Test
    @DisplayName("Resubmitting with the same idempotency key returns the original request")
    void idempotentSubmission() {
        NewTimeOffRequest input = request("2024-03-04T00:00:00Z", "2024-03-05T00:00:00Z")
            .idempotencyKey("req-42")
            .build();

        TimeOffRequest first = requestService.submitRequest(input);
        TimeOffRequest second = requestService.submitRequest(input);

        assertEquals(first.getId(), second.getId());
        assertEquals(1, requestService.listRequests(companyId, employeeId, null).size());
        assertEquals(480, balance().getHeldMinutes());
    }

    @Test
    @DisplayName("Repeating a transition is a no-op; leaving a final state is refused")
    void repeatedAndIllegalTransitions() {
        TimeOffRequest submitted = requestService.submitRequest(
            request("2024-03-04T00:00:00Z", "2024-03-05T00:00:00Z").build());
        requestService.approveRequest(companyId, submitted.getId(), managerId, null);

        TimeOffRequest again = requestService.approveRequest(companyId, submitted.getId(), managerId, null);

        assertEquals(RequestStatus.APPROVED, again.getStatus());
        assertEquals(3, requestEntries(submitted.getId()).size());
        assertThrows(InvalidTransitionException.class,
            () -> requestService.cancelRequest(companyId, submitted.getId(), employeeId));
        assertThrows(InvalidTransitionException.class,
            () -> requestService.denyRequest(companyId, submitted.getId(), managerId, null));
    }

    @Test
    @DisplayName("Overlapping pending requests are rejected")
    void overlapRejected() {
        requestService.submitRequest(request("2024-03-04T00:00:00Z", "2024-03-05T00:00:00Z").build());

        assertThrows(ValidationException.class, () -> requestService.submitRequest(
            request("2024-03-04T12:00:00Z", "2024-03-04T14:00:00Z").build()));
        assertEquals(480, balance().getHeldMinutes());
    }

    @Test
    @DisplayName("A range with no working time is rejected")
    void zeroMinuteRangeRejected() {
        // 2024-03-09 and 2024-03-10 are a weekend
        assertThrows(ValidationException.class, () -> requestService.submitRequest(
            request("2024-03-09T00:00:00Z", "2024-03-11T00:00:00Z").build()));
    }

    @Test
    @DisplayName("Holidays are not charged")
    void holidaysNotCharged() {
        addHoliday(LocalDate.of(2024, 3, 5));

        TimeOffRequest submitted = requestService.submitRequest(
            request("2024-03-04T00:00:00Z", "2024-03-06T00:00:00Z").build());

        assertEquals(480, submitted.getRequestedMinutes());
    }

    @Test
    @DisplayName("Wall-clock times are read in the employee's time zone")
    void localTimesUseEmployeeZone() {
        UUID newYorker = createEmployee(480, "America/New_York", null);
        assign(newYorker, policyId, LocalDate.of(2024, 1, 1));
        adjustmentService.createAdjustment(companyId, newYorker, policyId, 960, LocalDate.of(2024, 1, 1),
                "Opening balance", null, managerId);

        TimeOffRequest submitted = requestService.submitRequest(NewTimeOffRequest.builder()
            .companyId(companyId)
            .employeeId(newYorker)
            .policyId(policyId)
            .localStartAt(LocalDateTime.of(2024, 3, 4, 9, 0))
            .localEndAt(LocalDateTime.of(2024, 3, 4, 17, 0))
            .build());

        assertEquals(Instant.parse("2024-03-04T14:00:00Z"), submitted.getStartAt());
        assertEquals(480, submitted.getRequestedMinutes());
    }

    @Test
    @DisplayName("Requests need an active assignment on their start date")
    void requiresAssignment() {
        UUID unassigned = createEmployee(480, "UTC", null);

        assertThrows(ValidationException.class, () -> requestService.submitRequest(NewTimeOffRequest.builder()
            .companyId(companyId)
            .employeeId(unassigned)
            .policyId(policyId)
            .startAt(Instant.parse("2024-03-04T00:00:00Z"))
            .endAt(Instant.parse("2024-03-05T00:00:00Z"))
            .build()));
    }
}
