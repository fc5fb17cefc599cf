package com.flagship.pto_ledger.event;

import com.flagship.pto_ledger.request.RequestStatus;
import com.flagship.pto_ledger.request.TimeOffRequest;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published on every request status change, in the transaction that made the change.
 *
 * The event type names the new status: {@code TimeOffRequestSubmitted},
 * {@code TimeOffRequestApproved}, and so on.
 */
@Value
public class TimeOffRequestEvent implements TimeOffEvent {
    UUID eventId;
    UUID requestId;
    UUID companyId;
    UUID employeeId;
    UUID policyId;
    Instant startAt;
    Instant endAt;
    int requestedMinutes;
    RequestStatus previousStatus;
    RequestStatus status;
    UUID actorId;
    Instant occurredAt;

    public static final String EVENT_TYPE_PREFIX = "TimeOffRequest";

    @Override
    public UUID getAggregateId() {
        return requestId;
    }

    @Override
    public String getEventType() {
        String name = status.name();
        return EVENT_TYPE_PREFIX + name.charAt(0) + name.substring(1).toLowerCase();
    }

    public static TimeOffRequestEvent transitioned(TimeOffRequest request, RequestStatus previousStatus, UUID actorId) {
        return new TimeOffRequestEvent(
            UUID.randomUUID(),
            request.getId(),
            request.getCompanyId(),
            request.getEmployeeId(),
            request.getPolicyId(),
            request.getStartAt(),
            request.getEndAt(),
            request.getRequestedMinutes(),
            previousStatus,
            request.getStatus(),
            actorId,
            Instant.now()
        );
    }
}
