package com.flagship.pto_ledger.request;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Input for creating a request. The range is given either as instants or as wall-clock times,
 * which are read in the employee's timezone.
 */
@Value
@Builder
public class NewTimeOffRequest {
    UUID companyId;
    UUID employeeId;
    UUID policyId;
    Instant startAt;
    Instant endAt;
    LocalDateTime localStartAt;
    LocalDateTime localEndAt;
    String reason;
    String idempotencyKey;
    UUID actorId;
}
