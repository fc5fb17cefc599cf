package com.flagship.pto_ledger.request;

import com.flagship.pto_ledger.exception.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TimeOffRequestTest {

    private final UUID approver = UUID.randomUUID();
    private final Instant now = Instant.parse("2024-03-01T12:00:00Z");
    private final Instant createdAt = Instant.parse("2024-02-28T08:00:00Z");

    private TimeOffRequest draft() {
        return TimeOffRequest.draft(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                Instant.parse("2024-03-04T09:00:00Z"), Instant.parse("2024-03-04T17:00:00Z"), 480, "Trip",
                createdAt);
    }

    @Test
    @DisplayName("Submit then approve records submission and decision")
    void submitThenApprove() {
        TimeOffRequest submitted = draft().submit(now);
        TimeOffRequest approved = submitted.approve(approver, "ok", now.plusSeconds(60));

        assertEquals(RequestStatus.SUBMITTED, submitted.getStatus());
        assertTrue(submitted.holdsBalance());
        assertEquals(now, submitted.getSubmittedAt());

        assertEquals(RequestStatus.APPROVED, approved.getStatus());
        assertFalse(approved.holdsBalance());
        assertTrue(approved.isTerminal());
        assertEquals(approver, approved.getDecidedBy());
        assertEquals("ok", approved.getDecisionNote());
        assertEquals(now, approved.getSubmittedAt());
    }

    @Test
    @DisplayName("Drafts can be cancelled without ever holding minutes")
    void cancelDraft() {
        TimeOffRequest draft = draft();
        TimeOffRequest cancelled = draft.cancel(approver, now);

        assertFalse(draft.holdsBalance());
        assertEquals(RequestStatus.CANCELLED, cancelled.getStatus());
        assertNull(cancelled.getSubmittedAt());
    }

    @Test
    @DisplayName("Drafts cannot be approved or denied")
    void draftCannotBeDecided() {
        TimeOffRequest draft = draft();

        assertThrows(InvalidTransitionException.class, () -> draft.approve(approver, null, now));
        assertThrows(InvalidTransitionException.class, () -> draft.deny(approver, null, now));
        assertFalse(draft.canTransitionTo(RequestStatus.APPROVED));
    }

    @Test
    @DisplayName("Approved, denied and cancelled requests are final")
    void terminalStatesAreFinal() {
        TimeOffRequest approved = draft().submit(now).approve(approver, null, now);
        TimeOffRequest denied = draft().submit(now).deny(approver, "no", now);
        TimeOffRequest cancelled = draft().submit(now).cancel(approver, now);

        assertThrows(InvalidTransitionException.class, () -> approved.cancel(approver, now));
        assertThrows(InvalidTransitionException.class, () -> denied.approve(approver, null, now));
        assertThrows(InvalidTransitionException.class, () -> cancelled.submit(now));
        assertTrue(approved.canTransitionTo(RequestStatus.APPROVED));
        assertFalse(approved.canTransitionTo(RequestStatus.CANCELLED));
    }

    @Test
    @DisplayName("Timestamps come from the caller, not the wall clock")
    void timestampsFollowCallerClock() {
        TimeOffRequest draft = draft();
        TimeOffRequest submitted = draft.submit(now);
        TimeOffRequest denied = submitted.deny(approver, "no", now.plusSeconds(300));

        assertEquals(createdAt, draft.getCreatedAt());
        assertEquals(createdAt, draft.getUpdatedAt());
        assertEquals(now, submitted.getUpdatedAt());
        assertEquals(now.plusSeconds(300), denied.getUpdatedAt());
        assertEquals(now.plusSeconds(300), denied.getDecidedAt());
        assertEquals(createdAt, denied.getCreatedAt());
    }
}
