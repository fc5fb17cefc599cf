package com.flagship.pto_ledger.request;

import com.flagship.pto_ledger.exception.InvalidTransitionException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A time-off request and its state machine.
 *
 * Transitions return a new instance; an illegal transition throws
 * {@link InvalidTransitionException}. Ledger effects are the service's concern.
 */
@Value
public class TimeOffRequest {
    UUID id;
    UUID companyId;
    UUID employeeId;
    UUID policyId;
    Instant startAt;
    Instant endAt;
    int requestedMinutes;
    String reason;
    RequestStatus status;
    Instant submittedAt;
    Instant decidedAt;
    UUID decidedBy;
    String decisionNote;
    Instant createdAt;
    Instant updatedAt;

    public static TimeOffRequest draft(UUID companyId, UUID employeeId, UUID policyId,
                                       Instant startAt, Instant endAt, int requestedMinutes, String reason,
                                       Instant now) {
        return new TimeOffRequest(UUID.randomUUID(), companyId, employeeId, policyId, startAt, endAt,
                requestedMinutes, reason, RequestStatus.DRAFT, null, null, null, null, now, now);
    }

    /**
     * DRAFT → SUBMITTED.
     */
    public TimeOffRequest submit(Instant at) {
        requireStatus(RequestStatus.SUBMITTED, RequestStatus.DRAFT);
        return withStatus(RequestStatus.SUBMITTED, at, decidedAt, decidedBy, decisionNote, at);
    }

    /**
     * SUBMITTED → APPROVED.
     */
    public TimeOffRequest approve(UUID approverId, String note, Instant at) {
        requireStatus(RequestStatus.APPROVED, RequestStatus.SUBMITTED);
        return withStatus(RequestStatus.APPROVED, submittedAt, at, approverId, note, at);
    }

    /**
     * SUBMITTED → DENIED.
     */
    public TimeOffRequest deny(UUID approverId, String note, Instant at) {
        requireStatus(RequestStatus.DENIED, RequestStatus.SUBMITTED);
        return withStatus(RequestStatus.DENIED, submittedAt, at, approverId, note, at);
    }

    /**
     * DRAFT or SUBMITTED → CANCELLED.
     */
    public TimeOffRequest cancel(UUID actorId, Instant at) {
        requireStatus(RequestStatus.CANCELLED, RequestStatus.DRAFT, RequestStatus.SUBMITTED);
        return withStatus(RequestStatus.CANCELLED, submittedAt, at, actorId, decisionNote, at);
    }

    public boolean isTerminal() {
        return status == RequestStatus.APPROVED
            || status == RequestStatus.DENIED
            || status == RequestStatus.CANCELLED;
    }

    /**
     * Whether minutes are currently held for this request.
     */
    public boolean holdsBalance() {
        return status == RequestStatus.SUBMITTED;
    }

    public boolean canTransitionTo(RequestStatus target) {
        if (status == target) {
            return true;
        }
        return switch (status) {
            case DRAFT -> target == RequestStatus.SUBMITTED || target == RequestStatus.CANCELLED;
            case SUBMITTED -> target == RequestStatus.APPROVED
                || target == RequestStatus.DENIED
                || target == RequestStatus.CANCELLED;
            case APPROVED, DENIED, CANCELLED -> false;
        };
    }

    private void requireStatus(RequestStatus target, RequestStatus... allowed) {
        for (RequestStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new InvalidTransitionException(String.format(
            "Cannot move request %s from %s to %s", id, status, target));
    }

    private TimeOffRequest withStatus(RequestStatus next, Instant submitted, Instant decided,
                                      UUID decider, String note, Instant changedAt) {
        return new TimeOffRequest(id, companyId, employeeId, policyId, startAt, endAt, requestedMinutes,
                reason, next, submitted, decided, decider, note, createdAt, changedAt);
    }
}
